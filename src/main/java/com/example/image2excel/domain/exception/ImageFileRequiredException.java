package com.example.image2excel.domain.exception;

/**
 * Raised when the client attempts to run an upload flow without providing an image file.
 */
public class ImageFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public ImageFileRequiredException() {
        super("Please choose an image file to upload.");
    }
}
