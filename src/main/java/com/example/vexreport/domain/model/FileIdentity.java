package com.example.vexreport.domain.model;

import com.example.vexreport.domain.exception.InputFileNotFoundException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable (path, type) pair identifying one discovered input file.
 * Equality covers both components; since the type is derived from the path, identity reduces to path uniqueness.
 */
public record FileIdentity(Path path, InputFileType type) {

    public FileIdentity {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
    }

	/**
	 * Builds an identity for an existing path. Existence is checked once, here; a file deleted later
	 * surfaces as a read failure when the file is processed.
	 * The type comes from the extension alone: a directory named {@code x.json} is classified as JSON, so callers
	 * that need regular files must check that themselves.
	 *
	 * @param path filesystem path
	 * @return identity carrying the classified type
	 * @throws InputFileNotFoundException when the path does not exist
	 */
    public static FileIdentity of(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new InputFileNotFoundException(path);
        }
        return new FileIdentity(path, InputFileType.fromPath(path));
    }

    public boolean isSupportedType() {
        return type.isSupported();
    }
}
