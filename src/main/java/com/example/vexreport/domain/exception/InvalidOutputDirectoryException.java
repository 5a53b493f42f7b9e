package com.example.vexreport.domain.exception;

import java.nio.file.Path;

/**
 * Raised when the configured output directory points at a regular file.
 */
public class InvalidOutputDirectoryException extends DomainException {

	/**
	 * @param path configured output location
	 */
    public InvalidOutputDirectoryException(Path path) {
        super(path, "`" + path + "` should be a directory but isn't");
    }
}
