package com.example.plantreport.infrastructure.storage;

import com.example.plantreport.infrastructure.exception.ReportStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Report file held in ephemeral storage. Closing it deletes the file, so callers scope it with
 * try-with-resources and the file disappears on every exit path.
 */
public final class StoredReport implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StoredReport.class);

    private final String fileName;
    private final Path path;

	/**
	 * @param fileName name offered to the caller when downloading
	 * @param path     actual location on disk
	 */
    public StoredReport(String fileName, Path path) {
        this.fileName = fileName;
        this.path = path;
    }

    public String fileName() {
        return fileName;
    }

    public Path path() {
        return path;
    }

	/**
	 * @return full file content
	 * @throws ReportStorageException when the file cannot be read back
	 */
    public byte[] readAllBytes() {
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new ReportStorageException("Unable to read stored report " + path.getFileName(), ex);
        }
    }

    @Override
    public void close() {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Deleted stored report {}", path.getFileName());
            }
        } catch (IOException ex) {
            log.warn("Failed to delete stored report {}", path, ex);
        }
    }
}
