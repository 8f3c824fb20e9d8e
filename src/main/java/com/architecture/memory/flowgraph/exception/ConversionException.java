package com.architecture.memory.flowgraph.exception;

/**
 * A script could not be turned into a graph document.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
