package com.example.vexreport.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals a PDF report could not be laid out or written.
 */
public class ReportRenderingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox or IO exception
	 */
    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
