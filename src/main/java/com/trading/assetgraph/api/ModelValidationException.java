package com.trading.assetgraph.api;

/**
 * Raised when an asset or regulatory event is constructed from invalid data.
 * Such data never reaches the relationship store.
 */
public class ModelValidationException extends IllegalArgumentException {

    public ModelValidationException(String message) {
        super(message);
    }

    public ModelValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
