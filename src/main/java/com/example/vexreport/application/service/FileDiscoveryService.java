package com.example.vexreport.application.service;

import com.example.vexreport.domain.exception.DomainException;
import com.example.vexreport.domain.exception.FileIgnoredByUserException;
import com.example.vexreport.domain.exception.InputFileNotFoundException;
import com.example.vexreport.domain.model.InputFileType;
import com.example.vexreport.domain.model.PendingFiles;
import com.example.vexreport.infrastructure.exception.InputScanException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Application-layer service that collects the input files of a run.
 * A single file root must be accepted or the scan fails; a directory root is swept one level deep and
 * individual rejections are only logged.
 */
@Service
public class FileDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(FileDiscoveryService.class);

	/**
	 * Scans {@code root} for convertible files.
	 *
	 * @param root         file or directory
	 * @param ignoredTypes types deactivated by the user
	 * @return pending files, possibly empty
	 * @throws InputFileNotFoundException when {@code root} does not exist
	 * @throws DomainException            when {@code root} is a single file that is rejected
	 * @throws InputScanException         when {@code root} is a directory that cannot be listed
	 */
    public PendingFiles discover(Path root, Set<InputFileType> ignoredTypes) {
        Set<InputFileType> ignored = ignoredTypes == null || ignoredTypes.isEmpty()
                ? EnumSet.noneOf(InputFileType.class)
                : EnumSet.copyOf(ignoredTypes);
        ignored.forEach(type -> log.info("Skipping {} files: deactivated by user", type.uppercase()));

        PendingFiles pending = new PendingFiles();
        if (Files.isDirectory(root)) {
            scanDirectory(root, ignored, pending);
        } else {
            // explicit file: any rejection is the caller's problem
            pending.addSupportedFileUnlessIgnored(root, ignored);
        }

        reportResults(pending);
        return pending;
    }

    private void scanDirectory(Path directory, Set<InputFileType> ignored, PendingFiles pending) {
        log.info("Scanning for BoM/Vex files in {}", directory);
        try (Stream<Path> entries = listEntries(directory)) {
            Iterator<Path> iterator = entries.iterator();
            while (iterator.hasNext()) {
                Path entry = iterator.next();
                if (!Files.isRegularFile(entry)) {
                    continue;
                }
                try {
                    pending.addSupportedFileUnlessIgnored(entry, ignored);
                } catch (FileIgnoredByUserException ex) {
                    log.info("{}", ex.getMessage());
                } catch (DomainException ex) {
                    log.warn("{}", ex.getMessage());
                }
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new InputScanException("Unable to list the directory " + directory, ex);
        }
    }

    Stream<Path> listEntries(Path directory) throws IOException {
        return Files.list(directory);
    }

    private void reportResults(PendingFiles pending) {
        if (pending.isEmpty()) {
            log.info("No parseable files in selected path");
            return;
        }
        for (InputFileType type : InputFileType.recognizedTypes()) {
            log.info("Found {} {} files", pending.countByType(type), type.uppercase());
        }
    }
}
