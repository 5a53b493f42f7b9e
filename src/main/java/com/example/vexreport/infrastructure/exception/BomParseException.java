package com.example.vexreport.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals an input document could not be read or parsed.
 */
public class BomParseException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level IO or CycloneDX parser exception
	 */
    public BomParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
