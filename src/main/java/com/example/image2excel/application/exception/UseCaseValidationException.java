package com.example.image2excel.application.exception;

/**
 * Signals validation issues detected while running an application layer use case.
 * The command line runner reports it and stops; the HTTP layer translates it into a 400 response.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * Builds an exception containing a validation message that can be propagated to the UI.
	 *
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
