package com.example.image2excel.domain.exception;

/**
 * Raised when a conversion is started with a null {@link java.nio.file.Path}.
 */
public class ImagePathRequiredException extends DomainException {

    public ImagePathRequiredException() {
        super("Image path is required.");
    }
}
