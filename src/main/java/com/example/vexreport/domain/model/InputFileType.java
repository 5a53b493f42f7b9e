package com.example.vexreport.domain.model;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Locale;

/**
 * Domain enumeration describing which input formats the converter understands.
 * The type is derived from the file extension only, case-insensitively.
 */
public enum InputFileType {
    JSON,
    XML,
    UNSUPPORTED;

	/**
	 * Builds an {@link EnumSet} containing every recognized (parseable) type.
	 *
	 * @return enum set without {@link #UNSUPPORTED}
	 */
    public static EnumSet<InputFileType> recognizedTypes() {
        return EnumSet.of(JSON, XML);
    }

	/**
	 * Classifies a raw extension (without the leading dot).
	 *
	 * @param extension extension of the file name, may be {@code null}
	 * @return matching type or {@link #UNSUPPORTED} when missing or unknown
	 */
    public static InputFileType fromExtension(String extension) {
        if (extension == null) {
            return UNSUPPORTED;
        }
        return switch (extension.toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "xml" -> XML;
            default -> UNSUPPORTED;
        };
    }

	/**
	 * Classifies a path by the extension of its last name element.
	 *
	 * @param path filesystem path, it does not need to exist
	 * @return matching type or {@link #UNSUPPORTED}
	 */
    public static InputFileType fromPath(Path path) {
        return fromExtension(extensionOf(path));
    }

    /**
     * @return {@code true} for every type except {@link #UNSUPPORTED}
     */
    public boolean isSupported() {
        return this != UNSUPPORTED;
    }

	/**
	 * Lowercase representation used for file extension matching.
	 *
	 * @return {@code "json"} or {@code "xml"}
	 * @throws IllegalStateException when called on {@link #UNSUPPORTED}
	 */
    public String lowercase() {
        return switch (this) {
            case JSON -> "json";
            case XML -> "xml";
            case UNSUPPORTED -> throw new IllegalStateException("Unsupported type has no extension");
        };
    }

	/**
	 * Uppercase representation used in log lines and messages.
	 *
	 * @return {@code "JSON"} or {@code "XML"}
	 * @throws IllegalStateException when called on {@link #UNSUPPORTED}
	 */
    public String uppercase() {
        return lowercase().toUpperCase(Locale.ROOT);
    }

    private static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return null;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        // ".json" is a hidden file without an extension, "report." has an empty one
        if (dot <= 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1);
    }
}
