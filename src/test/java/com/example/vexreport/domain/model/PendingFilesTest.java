package com.example.vexreport.domain.model;

import com.example.vexreport.domain.exception.FileIgnoredByUserException;
import com.example.vexreport.domain.exception.InputFileNotFoundException;
import com.example.vexreport.domain.exception.UnsupportedFileTypeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the deduplicated pending-file set and the identities it holds.
 */
class PendingFilesTest {

    @TempDir
    Path tempDir;

    /**
     * Adding the same file twice keeps a single entry.
     */
    @Test
    void addingTheSameFileTwiceIsIdempotent() throws IOException {
        Path bom = Files.createFile(tempDir.resolve("bom.json"));
        PendingFiles pending = new PendingFiles();

        pending.addSupportedFile(bom);
        pending.addSupportedFile(bom);

        assertThat(pending.count()).isEqualTo(1);
        assertThat(pending.files()).containsExactly(new FileIdentity(bom, InputFileType.JSON));
    }

    @Test
    void missingFilesAreRejected() {
        PendingFiles pending = new PendingFiles();

        InputFileNotFoundException ex = assertThrows(InputFileNotFoundException.class,
                () -> pending.addSupportedFile(tempDir.resolve("missing.json")));

        assertThat(ex.getMessage()).contains("missing.json");
        assertThat(ex.getPath()).isEqualTo(tempDir.resolve("missing.json"));
        assertThat(pending.isEmpty()).isTrue();
    }

    @Test
    void unsupportedFilesAreRejected() throws IOException {
        Path notes = Files.createFile(tempDir.resolve("notes.txt"));
        PendingFiles pending = new PendingFiles();

        assertThrows(UnsupportedFileTypeException.class, () -> pending.addSupportedFile(notes));
        assertThat(pending.count()).isZero();
    }

    /**
     * A file of an ignored type reports the ignored outcome, not the unsupported one, and is never added.
     */
    @Test
    void ignoredTypesReportIgnoredByUser() throws IOException {
        Path xml = Files.createFile(tempDir.resolve("vex.xml"));
        Path json = Files.createFile(tempDir.resolve("vex.json"));
        PendingFiles pending = new PendingFiles();
        Set<InputFileType> ignored = EnumSet.of(InputFileType.XML);

        FileIgnoredByUserException ex = assertThrows(FileIgnoredByUserException.class,
                () -> pending.addSupportedFileUnlessIgnored(xml, ignored));
        pending.addSupportedFileUnlessIgnored(json, ignored);

        assertThat(ex.getFileType()).isEqualTo(InputFileType.XML);
        assertThat(pending.files()).extracting(FileIdentity::path).containsExactly(json);
    }

    /**
     * An unknown extension stays unsupported even when every recognized type is ignored.
     */
    @Test
    void unsupportedWinsOverIgnored() throws IOException {
        Path notes = Files.createFile(tempDir.resolve("notes.txt"));
        PendingFiles pending = new PendingFiles();

        assertThrows(UnsupportedFileTypeException.class,
                () -> pending.addSupportedFileUnlessIgnored(notes, InputFileType.recognizedTypes()));
    }

    @Test
    void countsFilesPerType() throws IOException {
        PendingFiles pending = new PendingFiles();
        pending.addSupportedFile(Files.createFile(tempDir.resolve("a.json")));
        pending.addSupportedFile(Files.createFile(tempDir.resolve("b.json")));
        pending.addSupportedFile(Files.createFile(tempDir.resolve("c.XML")));

        assertThat(pending.countByType(InputFileType.JSON)).isEqualTo(2);
        assertThat(pending.countByType(InputFileType.XML)).isEqualTo(1);
        assertThat(pending.countByType(InputFileType.UNSUPPORTED)).isZero();
    }

    /**
     * Draining hands out every file once and empties the set.
     */
    @Test
    void drainEmptiesTheSet() throws IOException {
        PendingFiles pending = new PendingFiles();
        pending.addSupportedFile(Files.createFile(tempDir.resolve("a.json")));
        pending.addSupportedFile(Files.createFile(tempDir.resolve("b.xml")));

        List<FileIdentity> drained = pending.drain();

        assertThat(drained).hasSize(2);
        assertThat(pending.isEmpty()).isTrue();
        assertThat(pending.drain()).isEmpty();
    }

    @Test
    void filesViewIsReadOnly() throws IOException {
        PendingFiles pending = new PendingFiles();
        Path bom = Files.createFile(tempDir.resolve("a.json"));
        pending.addSupportedFile(bom);

        assertThrows(UnsupportedOperationException.class,
                () -> pending.files().add(new FileIdentity(bom, InputFileType.JSON)));
    }

    /**
     * Classification looks at the name only, also for directories.
     */
    @Test
    void identityIsClassifiedByExtensionOnly() throws IOException {
        Path jsonNamedDir = Files.createDirectory(tempDir.resolve("nested.json"));
        Path plainDir = Files.createDirectory(tempDir.resolve("nested"));

        assertThat(FileIdentity.of(jsonNamedDir).type()).isEqualTo(InputFileType.JSON);
        assertThat(FileIdentity.of(plainDir).isSupportedType()).isFalse();
    }
}
