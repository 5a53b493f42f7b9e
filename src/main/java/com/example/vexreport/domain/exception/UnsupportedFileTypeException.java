package com.example.vexreport.domain.exception;

import java.nio.file.Path;

/**
 * Raised when a file extension does not map to a parseable document type.
 */
public class UnsupportedFileTypeException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param path rejected file
	 */
    public UnsupportedFileTypeException(Path path) {
        super(path, "Unsupported file type for parsing" + (path != null ? ": " + path : "."));
    }
}
