package com.example.plantreport.application.service;

import com.example.plantreport.TestImages;
import com.example.plantreport.application.port.DocumentWriter;
import com.example.plantreport.application.port.DocumentWriterFactory;
import com.example.plantreport.domain.exception.EmptyReportInputException;
import com.example.plantreport.domain.exception.ImageDecodeException;
import com.example.plantreport.domain.exception.ImageTooTallException;
import com.example.plantreport.domain.exception.UnsupportedImageFormatException;
import com.example.plantreport.domain.model.GeneratedReport;
import com.example.plantreport.domain.model.ImageAttachment;
import com.example.plantreport.domain.model.ReportRequest;
import com.example.plantreport.infrastructure.config.ReportProperties;
import com.example.plantreport.infrastructure.exception.RenderException;
import com.example.plantreport.infrastructure.image.ImageIoDimensionReader;
import com.example.plantreport.infrastructure.pdf.PdfBoxDocumentWriterFactory;
import com.example.plantreport.infrastructure.pdf.PdfBoxFontMetrics;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit and end-to-end tests for the report generation use case.
 */
class ReportGenerationServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:30:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final ReportProperties properties = new ReportProperties();
    private final ImageIoDimensionReader imageReader = new ImageIoDimensionReader(properties);

    /**
     * A GIF is rejected before the writer factory is touched.
     */
    @Test
    void unsupportedFormatNeverReachesWriter() {
        DocumentWriterFactory factory = mock(DocumentWriterFactory.class);
        ReportGenerationService service = new ReportGenerationService(properties, factory, imageReader, CLOCK);
        ReportRequest request = new ReportRequest("Healthy monstera.",
                new ImageAttachment("GIF89a".getBytes(StandardCharsets.US_ASCII), "image/gif"), null);

        assertThrows(UnsupportedImageFormatException.class, () -> service.generate(request));

        verifyNoInteractions(factory);
    }

    /**
     * No text and no image is rejected without invoking the writer.
     */
    @Test
    void emptyInputNeverReachesWriter() {
        DocumentWriterFactory factory = mock(DocumentWriterFactory.class);
        ReportGenerationService service = new ReportGenerationService(properties, factory, imageReader, CLOCK);

        assertThrows(EmptyReportInputException.class, () -> service.generate(new ReportRequest("", null, null)));
        assertThrows(EmptyReportInputException.class, () -> service.generate(new ReportRequest("  \n ", null, null)));
        assertThrows(EmptyReportInputException.class, () -> service.generate(null));

        verifyNoInteractions(factory);
    }

    @Test
    void undecodableImageNeverReachesWriter() {
        DocumentWriterFactory factory = mock(DocumentWriterFactory.class);
        ReportGenerationService service = new ReportGenerationService(properties, factory, imageReader, CLOCK);
        ReportRequest request = new ReportRequest("text", new ImageAttachment(TestImages.jpeg(8, 8), "image/png"), null);

        assertThrows(ImageDecodeException.class, () -> service.generate(request));

        verifyNoInteractions(factory);
    }

    /**
     * A readable header followed by a cut-off body is a decode error, not a render failure.
     */
    @Test
    void truncatedImagesNeverReachWriter() {
        DocumentWriterFactory factory = mock(DocumentWriterFactory.class);
        ReportGenerationService service = new ReportGenerationService(properties, factory, imageReader, CLOCK);
        byte[] jpeg = TestImages.jpeg(400, 300);
        ReportRequest truncatedJpeg = new ReportRequest("text",
                new ImageAttachment(TestImages.truncated(jpeg, jpeg.length / 3), "image/jpeg"), null);
        ReportRequest truncatedPng = new ReportRequest("text",
                new ImageAttachment(TestImages.truncated(TestImages.png(400, 300), 40), "image/png"), null);

        assertThrows(ImageDecodeException.class, () -> service.generate(truncatedJpeg));
        assertThrows(ImageDecodeException.class, () -> service.generate(truncatedPng));

        verifyNoInteractions(factory);
    }

    @Test
    void oversizedImageHeaderNeverReachesWriter() {
        DocumentWriterFactory factory = mock(DocumentWriterFactory.class);
        ReportGenerationService service = new ReportGenerationService(properties, factory, imageReader, CLOCK);
        ReportRequest request = new ReportRequest("text",
                new ImageAttachment(TestImages.pngHeaderOnly(60000, 60000), "image/png"), 0.01d);

        assertThrows(ImageDecodeException.class, () -> service.generate(request));

        verifyNoInteractions(factory);
    }

    @Test
    void tooTallImageFailsBeforeAnyDocumentIsCreated() {
        DocumentWriterFactory factory = spy(new PdfBoxDocumentWriterFactory());
        ReportGenerationService service = new ReportGenerationService(properties, factory, imageReader, CLOCK);
        ReportRequest request = new ReportRequest("text", new ImageAttachment(TestImages.png(20, 2000), "image/png"), 1d);

        assertThrows(ImageTooTallException.class, () -> service.generate(request));

        verify(factory, never()).create();
    }

    @Test
    void writerFailureSurfacesAsRenderException() {
        DocumentWriter writer = mock(DocumentWriter.class);
        when(writer.addPage(anyFloat(), anyFloat())).thenReturn(new DocumentWriter.PageHandle(0));
        when(writer.embedFont(anyString())).thenReturn(new DocumentWriter.FontHandle(0, "HELVETICA"));
        when(writer.save()).thenThrow(new RenderException("disk full"));
        DocumentWriterFactory factory = mock(DocumentWriterFactory.class);
        when(factory.fontMetrics(anyString())).thenReturn(PdfBoxFontMetrics.forFamily("HELVETICA"));
        when(factory.create()).thenReturn(writer);
        ReportGenerationService service = new ReportGenerationService(properties, factory, imageReader, CLOCK);

        assertThrows(RenderException.class, () -> service.generate(new ReportRequest("text", null, null)));

        verify(writer).close();
    }

    @Test
    void longTextFlowsOntoSeveralPagesFollowedByImage() throws IOException {
        ReportGenerationService service = realService();
        String text = IntStream.rangeClosed(1, 120)
                .mapToObj(i -> "Observation " + i + ": leaves are glossy and the soil is moist.")
                .collect(Collectors.joining("\n"));
        ReportRequest request = new ReportRequest(text, new ImageAttachment(TestImages.png(300, 200), "image/png"), null);

        GeneratedReport report = service.generate(request);

        assertThat(report.fileName()).isEqualTo("plant_analysis_report_" + NOW.toEpochMilli() + ".pdf");
        assertThat(report.pageCount()).isGreaterThan(2);
        try (PDDocument document = Loader.loadPDF(report.content())) {
            assertThat(document.getNumberOfPages()).isEqualTo(report.pageCount());
            String extracted = new PDFTextStripper().getText(document);
            assertThat(extracted).contains("Plant Analysis Report", "Date: 2026-10-19",
                    "Observation 1:", "Observation 120:");
            PDPage lastPage = document.getPage(document.getNumberOfPages() - 1);
            assertThat(lastPage.getResources().getXObjectNames()).isNotEmpty();
        }
    }

    @Test
    void imageOnlyReportRendersHeadingAndImage() throws IOException {
        ReportGenerationService service = realService();
        ReportRequest request = new ReportRequest(null, new ImageAttachment(TestImages.jpeg(120, 80), "image/jpeg"), 0.5d);

        GeneratedReport report = service.generate(request);

        assertThat(report.pageCount()).isEqualTo(1);
        try (PDDocument document = Loader.loadPDF(report.content())) {
            assertThat(document.getPage(0).getResources().getXObjectNames()).hasSize(1);
            assertThat(document.getDocumentInformation().getTitle()).isEqualTo("Plant Analysis Report");
        }
    }

    @Test
    void headingCanBeDisabled() throws IOException {
        properties.setHeadingEnabled(false);
        ReportGenerationService service = realService();

        GeneratedReport report = service.generate(new ReportRequest("Only the analysis.", null, null));

        try (PDDocument document = Loader.loadPDF(report.content())) {
            String extracted = new PDFTextStripper().getText(document);
            assertThat(extracted).contains("Only the analysis.").doesNotContain("Date:");
        }
    }

    /**
     * Two independent writers fed the same request at the same instant produce identical bytes.
     */
    @Test
    void renderingIsByteForByteRepeatable() {
        ReportGenerationService service = realService();
        ReportRequest request = new ReportRequest("Species: Ficus lyrata\nHealth: good\nWater weekly.",
                new ImageAttachment(TestImages.png(64, 48), "image/png"), 0.5d);

        GeneratedReport first = service.generate(request);
        GeneratedReport second = service.generate(request);

        assertThat(second.content()).isEqualTo(first.content());
    }

    private ReportGenerationService realService() {
        return new ReportGenerationService(properties, new PdfBoxDocumentWriterFactory(), imageReader, CLOCK);
    }
}
