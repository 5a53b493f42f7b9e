package com.example.vexreport.infrastructure.exception;

/**
 * Failure of an adapter: filesystem listing, the CycloneDX parsers, PDF output or the worker threads.
 * Subclasses say whether the failure affects one document or the whole run.
 */
public abstract class InfrastructureException extends RuntimeException {

    protected InfrastructureException(String message) {
        super(message);
    }

	/**
	 * @param message what the adapter was doing
	 * @param cause   library or IO exception, may be {@code null}
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
