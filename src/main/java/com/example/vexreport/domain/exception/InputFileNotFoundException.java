package com.example.vexreport.domain.exception;

import java.nio.file.Path;

/**
 * Raised when a discovered or explicitly named input path does not exist on disk.
 */
public class InputFileNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path path that could not be resolved
	 */
    public InputFileNotFoundException(Path path) {
        super(path, "File does not exist: " + path);
    }
}
