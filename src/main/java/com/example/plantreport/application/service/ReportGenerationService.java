package com.example.plantreport.application.service;

import com.example.plantreport.application.port.DocumentWriterFactory;
import com.example.plantreport.application.service.ReportLayoutComposer.ReportHeading;
import com.example.plantreport.domain.exception.EmptyReportInputException;
import com.example.plantreport.domain.exception.ImageDecodeException;
import com.example.plantreport.domain.exception.ImageTooTallException;
import com.example.plantreport.domain.exception.InvalidImageScaleException;
import com.example.plantreport.domain.exception.UnsupportedImageFormatException;
import com.example.plantreport.domain.layout.FontMetrics;
import com.example.plantreport.domain.model.DecodedImage;
import com.example.plantreport.domain.model.DocumentLayout;
import com.example.plantreport.domain.model.GeneratedReport;
import com.example.plantreport.domain.model.ImageAttachment;
import com.example.plantreport.domain.model.ImageFormat;
import com.example.plantreport.domain.model.LayoutConfig;
import com.example.plantreport.domain.model.ReportMetadata;
import com.example.plantreport.domain.model.ReportRequest;
import com.example.plantreport.infrastructure.config.ReportProperties;
import com.example.plantreport.infrastructure.exception.RenderException;
import com.example.plantreport.infrastructure.image.ImageIoDimensionReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Application-layer service that turns analysis text and an optional image into a PDF report.
 * It validates inputs, plans the layout with request-scoped planners and renders through a fresh writer,
 * so concurrent calls share no mutable state.
 */
@Service
public class ReportGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerationService.class);
    private static final String FILE_NAME_PREFIX = "plant_analysis_report_";
    private static final String FILE_EXTENSION = ".pdf";

    private final ReportProperties properties;
    private final DocumentWriterFactory writerFactory;
    private final ImageIoDimensionReader imageReader;
    private final Clock clock;

	/**
	 * Creates the service with its collaborators.
	 *
	 * @param properties    externalized layout and branding settings
	 * @param writerFactory source of per-report writers and font metrics
	 * @param imageReader   helper validating image payloads against their declared format
	 * @param clock         time source for the heading date, metadata and file name
	 */
    public ReportGenerationService(ReportProperties properties,
                                   DocumentWriterFactory writerFactory,
                                   ImageIoDimensionReader imageReader,
                                   Clock clock) {
        this.properties = properties;
        this.writerFactory = writerFactory;
        this.imageReader = imageReader;
        this.clock = clock;
    }

	/**
	 * Generates the report. Input is fully validated before the document writer is created.
	 *
	 * @param request text, optional image and scale
	 * @return serialized report with its download file name
	 * @throws EmptyReportInputException        when there is neither text nor an image
	 * @throws UnsupportedImageFormatException  when the image mime type is not JPEG or PNG
	 * @throws ImageDecodeException             when the image bytes do not decode as the declared format
	 * @throws InvalidImageScaleException       when the scale is not a positive number
	 * @throws ImageTooTallException            when the scaled image cannot fit on a page
	 * @throws RenderException                  when PDFBox fails to build or serialize the document
	 */
    public GeneratedReport generate(ReportRequest request) {
        if (request == null || (!request.hasText() && !request.hasImage())) {
            throw new EmptyReportInputException();
        }
        DecodedImage image = decode(request.image());
        double scale = request.scale() != null ? request.scale() : properties.getDefaultScale();

        Instant now = clock.instant();
        LayoutConfig config = properties.getLayout().toLayoutConfig();
        FontMetrics metrics = writerFactory.fontMetrics(properties.getFontFamily());
        DocumentLayout layout = new ReportLayoutComposer(config, metrics, properties.getFontFamily())
                .compose(heading(now), request.text(), image, scale);

        ReportMetadata metadata = new ReportMetadata(properties.getTitle(), properties.getCreator(), now);
        byte[] content = new ReportRenderer(writerFactory.create()).render(layout, metadata);

        String fileName = FILE_NAME_PREFIX + now.toEpochMilli() + FILE_EXTENSION;
        log.info("Generated {} with {} page(s), {} text line(s), image={} ({} bytes)",
                fileName, layout.pageCount(), layout.textLines().size(), image != null, content.length);
        return new GeneratedReport(fileName, content, layout.pageCount());
    }

    private DecodedImage decode(ImageAttachment attachment) {
        if (attachment == null) {
            return null;
        }
        ImageFormat format = ImageFormat.fromMimeType(attachment.mimeType());
        return imageReader.read(attachment.bytes(), format);
    }

    private ReportHeading heading(Instant now) {
        if (!properties.isHeadingEnabled()) {
            return null;
        }
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        String date = DateTimeFormatter.ofPattern(properties.getDatePattern()).format(today);
        return new ReportHeading(properties.getTitle(), "Date: " + date);
    }
}
