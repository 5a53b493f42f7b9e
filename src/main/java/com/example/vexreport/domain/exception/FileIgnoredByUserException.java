package com.example.vexreport.domain.exception;

import com.example.vexreport.domain.model.InputFileType;

import java.nio.file.Path;

/**
 * Raised when a supported file is skipped because its type was deactivated in the configuration.
 * This is an informational outcome rather than a problem with the file itself.
 */
public class FileIgnoredByUserException extends DomainException {

    private final InputFileType fileType;

	/**
	 * Creates the exception for the skipped file.
	 *
	 * @param path     skipped file
	 * @param fileType type that the user deactivated
	 */
    public FileIgnoredByUserException(Path path, InputFileType fileType) {
        super(path, "File ignored explicitly by user (" + fileType.uppercase() + " processing is off): " + path);
        this.fileType = fileType;
    }

    public InputFileType getFileType() {
        return fileType;
    }
}
