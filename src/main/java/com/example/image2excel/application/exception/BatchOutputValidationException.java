package com.example.image2excel.application.exception;

/**
 * Dedicated exception for batch conversion requests whose output target is unusable.
 * Thrown when a directory of images is converted but the named output is not an existing directory.
 */
public class BatchOutputValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception describing why the batch request is invalid.
	 *
	 * @param message validation message suitable for display
	 */
    public BatchOutputValidationException(String message) {
        super(message);
    }
}
