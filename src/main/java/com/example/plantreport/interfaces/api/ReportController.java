package com.example.plantreport.interfaces.api;

import com.example.plantreport.application.service.ReportGenerationService;
import com.example.plantreport.domain.model.GeneratedReport;
import com.example.plantreport.infrastructure.storage.ReportStorage;
import com.example.plantreport.infrastructure.storage.StoredReport;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * Interfaces-layer controller that renders a PDF report and hands it to the browser as a download.
 * Errors propagate to {@code GlobalExceptionHandler}.
 */
@Controller
public class ReportController {

    private final ReportGenerationService reportGenerationService;
    private final ReportStorage reportStorage;

	/**
	 * Creates the controller with the required services.
	 *
	 * @param reportGenerationService service responsible for layout and rendering
	 * @param reportStorage           ephemeral storage the report passes through
	 */
    public ReportController(ReportGenerationService reportGenerationService, ReportStorage reportStorage) {
        this.reportGenerationService = reportGenerationService;
        this.reportStorage = reportStorage;
    }

	/**
	 * Generates the report, stores it and returns it; the stored file is deleted before the method returns.
	 *
	 * @param body analysis text, optional data URI image and scale
	 * @return PDF document as an attachment
	 */
    @PostMapping(value = "/download", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<byte[]> download(@RequestBody ReportDownloadRequest body) {
        GeneratedReport report = reportGenerationService.generate(body.toReportRequest());
        try (StoredReport stored = reportStorage.store(report)) {
            byte[] content = stored.readAllBytes();
            ContentDisposition disposition = ContentDisposition.attachment().filename(stored.fileName()).build();
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                    .contentType(MediaType.APPLICATION_PDF)
                    .contentLength(content.length)
                    .body(content);
        }
    }
}
