package com.vidnyan.lre.application.port.out;

/**
 * A rulebook source could not be read or parsed. Fatal to the load call.
 */
public class RulebookLoadException extends RuntimeException {

    public RulebookLoadException(String message) {
        super(message);
    }

    public RulebookLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
