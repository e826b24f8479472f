package com.example.image2excel.domain.exception;

/**
 * Raised when no installed image reader recognizes the supplied bytes.
 * Batch runs rely on this to skip non-image files found in the input directory.
 */
public class UnsupportedImageFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedImageFormatException(String fileName) {
        super("Not a supported image file" + (fileName != null ? ": " + fileName : "."));
    }
}
