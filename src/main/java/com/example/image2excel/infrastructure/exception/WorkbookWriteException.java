package com.example.image2excel.infrastructure.exception;

import java.nio.file.Path;

/**
 * Raised when a finished workbook cannot be persisted.
 * The {@link Reason} lets callers tell a missing directory apart from a locked or read-only file.
 */
public class WorkbookWriteException extends InfrastructureException {

    /**
     * Coarse classification of the write failure.
     */
    public enum Reason {
        PATH_NOT_FOUND,
        PERMISSION_DENIED,
        WRITE_FAILURE
    }

    private final Reason reason;
    private final Path target;

	/**
	 * Creates the exception for a failed save.
	 *
	 * @param reason classification of the failure
	 * @param target destination path of the workbook
	 * @param cause  exception thrown by the filesystem or POI
	 */
    public WorkbookWriteException(Reason reason, Path target, Throwable cause) {
        super(describe(reason, target), cause);
        this.reason = reason;
        this.target = target;
    }

	/**
	 * Creates the exception for a workbook that could not be rendered in memory.
	 *
	 * @param message description of the failure
	 * @param cause   exception thrown by POI
	 */
    public WorkbookWriteException(String message, Throwable cause) {
        super(message, cause);
        this.reason = Reason.WRITE_FAILURE;
        this.target = null;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return destination path, {@code null} for in-memory rendering
     */
    public Path getTarget() {
        return target;
    }

    private static String describe(Reason reason, Path target) {
        return switch (reason) {
            case PATH_NOT_FOUND -> "Cannot save " + target + ": please verify the path is valid.";
            case PERMISSION_DENIED -> "Cannot save " + target
                    + ": the file may exist and be read-only, or is already open elsewhere.";
            case WRITE_FAILURE -> "Something went wrong saving " + target + ".";
        };
    }
}
