package com.vidnyan.lre.application.port.out;

import com.vidnyan.lre.domain.rule.Rulebook;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Port for loading rulebooks.
 * Implementations fail closed: an incomplete source raises, it is never defaulted.
 */
public interface RulebookRepository {

    /**
     * Load a rulebook from a file.
     */
    Rulebook load(Path path);

    /**
     * Load a rulebook from a stream; {@code sourceName} is used in error messages only.
     */
    Rulebook load(InputStream source, String sourceName);

    /**
     * Load the bundled rulebook from its configured location.
     */
    Rulebook loadDefault();
}
