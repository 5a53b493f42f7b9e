package com.example.vexreport.domain.model;

import com.example.vexreport.domain.exception.FileIgnoredByUserException;
import com.example.vexreport.domain.exception.InputFileNotFoundException;
import com.example.vexreport.domain.exception.UnsupportedFileTypeException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicated set of input files awaiting conversion.
 * Only supported, non-ignored types ever enter the set, so consumers never see {@link InputFileType#UNSUPPORTED}.
 * Iteration order is unspecified. Instances are not thread-safe; they are filled by a single scan and then drained.
 */
public class PendingFiles {

    private final Set<FileIdentity> files;

    public PendingFiles() {
        this.files = new HashSet<>();
    }

	/**
	 * Adds a file when its type is supported. Adding an already present file is a successful no-op.
	 *
	 * @param path file to add
	 * @throws InputFileNotFoundException   when the path does not exist
	 * @throws UnsupportedFileTypeException when the extension is not recognized
	 */
    public void addSupportedFile(Path path) {
        FileIdentity identity = FileIdentity.of(path);
        if (!identity.isSupportedType()) {
            throw new UnsupportedFileTypeException(path);
        }
        files.add(identity);
    }

	/**
	 * Same as {@link #addSupportedFile(Path)} but refuses types the user deactivated.
	 *
	 * @param path         file to add
	 * @param ignoredTypes types that must not be processed
	 * @throws InputFileNotFoundException   when the path does not exist
	 * @throws UnsupportedFileTypeException when the extension is not recognized
	 * @throws FileIgnoredByUserException   when the type is part of {@code ignoredTypes}
	 */
    public void addSupportedFileUnlessIgnored(Path path, Set<InputFileType> ignoredTypes) {
        FileIdentity identity = FileIdentity.of(path);
        if (!identity.isSupportedType()) {
            throw new UnsupportedFileTypeException(path);
        }
        if (ignoredTypes != null && ignoredTypes.contains(identity.type())) {
            throw new FileIgnoredByUserException(path, identity.type());
        }
        files.add(identity);
    }

    public int count() {
        return files.size();
    }

	/**
	 * Counts pending files of one type.
	 *
	 * @param type type to count
	 * @return number of pending files with that type, always 0 for {@link InputFileType#UNSUPPORTED}
	 */
    public int countByType(InputFileType type) {
        return (int) files.stream()
                .filter(file -> file.type() == type)
                .count();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * @return read-only view of the pending files
     */
    public Set<FileIdentity> files() {
        return Collections.unmodifiableSet(files);
    }

	/**
	 * Hands every pending file over to the caller exactly once and leaves this set empty.
	 *
	 * @return pending files in unspecified order
	 */
    public List<FileIdentity> drain() {
        List<FileIdentity> drained = new ArrayList<>(files);
        files.clear();
        return drained;
    }
}
