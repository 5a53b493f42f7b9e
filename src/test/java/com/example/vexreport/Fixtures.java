package com.example.vexreport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Access to the CycloneDX documents under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static byte[] bytes(String name) {
        try (InputStream in = open(name)) {
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

	/**
	 * Copies a fixture into {@code target}, creating parent directories.
	 *
	 * @param name   fixture file name
	 * @param target destination file
	 * @return {@code target}
	 */
    public static Path copy(String name, Path target) {
        try (InputStream in = open(name)) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static InputStream open(String name) {
        InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name);
        if (in == null) {
            throw new IllegalArgumentException("Missing fixture " + name);
        }
        return in;
    }
}
