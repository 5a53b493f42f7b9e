package com.example.vexreport.infrastructure.exception;

/**
 * Raised when the job dispatcher becomes unusable: no processor count available, no live worker left to
 * receive a job, or an interrupted shutdown. Not retryable.
 */
public class JobDispatchException extends InfrastructureException {

	/**
	 * @param message description of the dispatcher state
	 */
    public JobDispatchException(String message) {
        super(message);
    }

	/**
	 * @param message description of the dispatcher state
	 * @param cause   interruption or other low-level cause
	 */
    public JobDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
