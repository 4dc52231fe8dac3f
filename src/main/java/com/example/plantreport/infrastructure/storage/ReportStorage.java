package com.example.plantreport.infrastructure.storage;

import com.example.plantreport.domain.model.GeneratedReport;
import com.example.plantreport.infrastructure.config.ReportProperties;
import com.example.plantreport.infrastructure.exception.ReportStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Ephemeral directory for generated reports.
 * <p>
 * Files are written under a UUID-suffixed name so concurrent requests never collide, and go through a
 * {@code .part} file first so a failed write never leaves a truncated report behind.
 */
@Component
public class ReportStorage {

    private static final Logger log = LoggerFactory.getLogger(ReportStorage.class);
    private static final String PARTIAL_SUFFIX = ".part";

    private final Path directory;

    @Autowired
    public ReportStorage(ReportProperties properties) {
        this(Path.of(properties.getStorageDir()));
    }

    public ReportStorage(Path directory) {
        this.directory = directory;
    }

	/**
	 * Persists a report until the returned handle is closed.
	 *
	 * @param report generated report
	 * @return handle that deletes the file on {@link StoredReport#close()}
	 * @throws ReportStorageException when the directory or file cannot be written
	 */
    public StoredReport store(GeneratedReport report) {
        Path target = directory.resolve(uniqueName(report.fileName()));
        Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
        try {
            Files.createDirectories(directory);
            Files.write(partial, report.content(), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            moveIntoPlace(partial, target);
        } catch (IOException ex) {
            deletePartial(partial);
            throw new ReportStorageException("Unable to store report " + report.fileName(), ex);
        }
        log.debug("Stored report {} ({} bytes)", target.getFileName(), report.content().length);
        return new StoredReport(report.fileName(), target);
    }

    public Path directory() {
        return directory;
    }

    private String uniqueName(String fileName) {
        int extension = fileName.lastIndexOf('.');
        String stem = extension > 0 ? fileName.substring(0, extension) : fileName;
        String suffix = extension > 0 ? fileName.substring(extension) : "";
        return stem + "-" + UUID.randomUUID() + suffix;
    }

    private void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException ex) {
            log.warn("Failed to remove partial report {}", partial, ex);
        }
    }
}
