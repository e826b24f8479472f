package com.example.image2excel.domain.exception;

/**
 * Base type for all domain-level exceptions in the conversion model.
 * Subclasses describe why a given input image cannot be turned into a grid, without leaking
 * decoder or spreadsheet library details.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule the input broke
	 */
    protected DomainException(String message) {
        super(message);
    }
}
