package com.tyron.multicode.core.generate;

/**
 * Code could not be generated from the current visual state. Nothing was emitted.
 */
public abstract class GenerationException extends Exception {

    protected GenerationException(String message) {
        super(message);
    }
}
