package com.example.plantreport.infrastructure.storage;

import com.example.plantreport.domain.model.GeneratedReport;
import com.example.plantreport.infrastructure.exception.ReportStorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReportStorageTest {

    private static final GeneratedReport REPORT = new GeneratedReport("plant_analysis_report_1.pdf",
            "%PDF-1.7 test".getBytes(StandardCharsets.US_ASCII), 1);

    @TempDir
    Path tempDir;

    @Test
    void storedReportIsReadableUntilClosed() {
        ReportStorage storage = new ReportStorage(tempDir.resolve("reports"));

        Path path;
        try (StoredReport stored = storage.store(REPORT)) {
            path = stored.path();
            assertThat(stored.fileName()).isEqualTo("plant_analysis_report_1.pdf");
            assertThat(path).exists().hasParentRaw(tempDir.resolve("reports"));
            assertThat(path.getFileName().toString()).startsWith("plant_analysis_report_1-").endsWith(".pdf");
            assertThat(stored.readAllBytes()).isEqualTo(REPORT.content());
        }

        assertThat(path).doesNotExist();
    }

    @Test
    void concurrentReportsWithTheSameNameDoNotCollide() throws IOException {
        ReportStorage storage = new ReportStorage(tempDir);

        try (StoredReport first = storage.store(REPORT); StoredReport second = storage.store(REPORT)) {
            assertThat(first.path()).isNotEqualTo(second.path());
            try (Stream<Path> files = Files.list(tempDir)) {
                assertThat(files.map(Path::toString)).hasSize(2).noneMatch(name -> name.endsWith(".part"));
            }
        }
    }

    @Test
    void unwritableDirectoryIsStorageException() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("reports"), "a file, not a directory");
        ReportStorage storage = new ReportStorage(blocker);

        assertThrows(ReportStorageException.class, () -> storage.store(REPORT));
    }

    @Test
    void closingTwiceIsHarmless() {
        StoredReport stored = new ReportStorage(tempDir).store(REPORT);

        stored.close();
        stored.close();

        assertThat(stored.path()).doesNotExist();
    }
}
