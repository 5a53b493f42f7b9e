package com.example.vexreport.infrastructure.exception;

/**
 * Raised when the scan root directory cannot be listed. Aborts the whole run.
 */
public class InputScanException extends InfrastructureException {

	/**
	 * @param message description of the directory that failed
	 * @param cause   IO exception from the file system
	 */
    public InputScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
