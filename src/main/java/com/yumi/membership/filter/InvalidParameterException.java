package com.yumi.membership.filter;

/**
 * Thrown when a filter, or the parameters used to size one, cannot be built from the given values.
 */
public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
