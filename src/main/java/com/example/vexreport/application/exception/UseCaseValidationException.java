package com.example.vexreport.application.exception;

/**
 * Input to a use case was rejected before any file was touched.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message what was wrong with the request, phrased for the operator
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
