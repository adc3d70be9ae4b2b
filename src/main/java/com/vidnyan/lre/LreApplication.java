package com.vidnyan.lre;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * LRE - Legal Rule Evaluation Engine
 *
 * Deterministic evaluation of insolvency cases against a declarative rulebook.
 */
@SpringBootApplication
public class LreApplication {

    public static void main(String[] args) {
        SpringApplication.run(LreApplication.class, args);
    }
}
