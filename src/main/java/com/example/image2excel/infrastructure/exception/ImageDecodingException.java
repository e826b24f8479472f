package com.example.image2excel.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while decoding image bytes with ImageIO.
 */
public class ImageDecodingException extends InfrastructureException {

	/**
	 * Creates the exception with a contextual message and the root cause from the image reader.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level ImageIO exception
	 */
    public ImageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
