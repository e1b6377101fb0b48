package com.trading.assetgraph.api;

/**
 * Raised where external or cached relationship data re-enters the core and
 * does not have the expected shape: wrong arity, non-numeric strength, blank
 * identifiers, duplicate ids.
 * <p>
 * Never raised for data produced by relationship inference.
 */
public class StructuralValidationException extends IllegalArgumentException {

    public StructuralValidationException(String message) {
        super(message);
    }

    public StructuralValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
