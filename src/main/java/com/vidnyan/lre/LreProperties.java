package com.vidnyan.lre;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the rule evaluation engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "lre")
public class LreProperties {

    private RulebookSettings rulebook = new RulebookSettings();

    private EngineSettings engine = new EngineSettings();

    @Data
    public static class RulebookSettings {

        /**
         * Location of the bundled rulebook, any Spring resource location.
         * Default: classpath:rulebook/trlc_rules.json
         */
        private String location = "classpath:rulebook/trlc_rules.json";

        /**
         * Further locations tried in order when the primary one does not exist.
         */
        private List<String> fallbackLocations = new ArrayList<>();

        public List<String> candidates() {
            List<String> candidates = new ArrayList<>();
            candidates.add(location);
            candidates.addAll(fallbackLocations);
            return candidates;
        }
    }

    @Data
    public static class EngineSettings {

        /**
         * Articles named in the conclusion of a result with findings.
         */
        private int maxConclusionArticles = 5;
    }
}
