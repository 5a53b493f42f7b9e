package com.example.vexreport.domain.exception;

import java.nio.file.Path;

/**
 * Rejection of one input path by the core model.
 * During a directory scan these are logged and the scan moves on; for an explicitly named file they end the run.
 */
public abstract class DomainException extends RuntimeException {

    private final Path path;

	/**
	 * @param path    rejected path, may be {@code null} when no path could be determined
	 * @param message rejection reason, already mentioning the path
	 */
    protected DomainException(Path path, String message) {
        super(message);
        this.path = path;
    }

    /**
     * @return the rejected path, or {@code null}
     */
    public Path getPath() {
        return path;
    }
}
