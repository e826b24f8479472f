package com.example.image2excel.domain.exception;

/**
 * Raised when a referenced image path does not exist on disk.
 */
public class ImageNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public ImageNotFoundException(String path) {
        super("Image file not found: " + path + ". Please verify the path is valid and the file exists.");
    }
}
