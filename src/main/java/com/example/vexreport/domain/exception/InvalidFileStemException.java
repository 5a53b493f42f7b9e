package com.example.vexreport.domain.exception;

import java.nio.file.Path;

/**
 * Raised when no base name can be extracted from an input path to name its report.
 */
public class InvalidFileStemException extends DomainException {

	/**
	 * @param path input path without a usable file name
	 */
    public InvalidFileStemException(Path path) {
        super(path, "Failed to extract filename stem from `" + path + "`");
    }
}
