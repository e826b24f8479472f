package com.example.image2excel.infrastructure.exception;

/**
 * Raised when the files of a batch input directory cannot be listed.
 */
public class InputListingException extends InfrastructureException {

    public InputListingException(String message, Throwable cause) {
        super(message, cause);
    }
}
