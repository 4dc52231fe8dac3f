package com.example.plantreport.infrastructure.pdf;

import com.example.plantreport.application.port.DocumentWriter;
import com.example.plantreport.domain.model.ImageFormat;
import com.example.plantreport.domain.model.ReportMetadata;
import com.example.plantreport.domain.model.RgbColor;
import com.example.plantreport.infrastructure.exception.RenderException;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.xml.transform.TransformerException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.List;
import java.util.Locale;
import java.util.TimeZone;

/**
 * PDFBox implementation of {@link DocumentWriter}.
 * <p>
 * Each page keeps one open content stream until {@link #save()}. Every drawing call also feeds a content
 * fingerprint; together with the creation date it becomes the trailer {@code /ID}, so two writers fed
 * the same calls and metadata produce identical bytes.
 */
public class PdfBoxDocumentWriter implements DocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentWriter.class);
    private static final String PRODUCER = "Apache PDFBox";

    private final PDDocument document = new PDDocument();
    private final List<PDPage> pages = new ArrayList<>();
    private final List<PDPageContentStream> contentStreams = new ArrayList<>();
    private final List<PDFont> fonts = new ArrayList<>();
    private final List<PDImageXObject> images = new ArrayList<>();
    private final MessageDigest fingerprint = newDigest();
    private ReportMetadata metadata;
    private boolean streamsClosed;

    @Override
    public PageHandle addPage(float width, float height) {
        PDPage page = new PDPage(new PDRectangle(width, height));
        document.addPage(page);
        try {
            contentStreams.add(new PDPageContentStream(document, page));
        } catch (IOException ex) {
            throw new RenderException("Unable to open a content stream for page " + pages.size(), ex);
        }
        pages.add(page);
        fingerprint(String.format(Locale.ROOT, "page|%.3f|%.3f", width, height));
        return new PageHandle(pages.size() - 1);
    }

    @Override
    public FontHandle embedFont(String family) {
        fonts.add(StandardFonts.load(family));
        fingerprint("font|" + family);
        return new FontHandle(fonts.size() - 1, family);
    }

    @Override
    public void drawText(PageHandle page, FontHandle font, float x, float y, float size, RgbColor color, String text) {
        PDPageContentStream stream = contentStream(page);
        try {
            stream.beginText();
            stream.setFont(fonts.get(font.index()), size);
            stream.setNonStrokingColor(color.red(), color.green(), color.blue());
            stream.newLineAtOffset(x, y);
            stream.showText(text);
            stream.endText();
        } catch (IOException | IllegalArgumentException ex) {
            throw new RenderException("Unable to draw text on page " + page.index(), ex);
        }
        fingerprint(String.format(Locale.ROOT, "text|%d|%.3f|%.3f|%.3f|%s", page.index(), x, y, size, text));
    }

    @Override
    public ImageHandle embedImage(byte[] bytes, ImageFormat format) {
        try {
            PDImageXObject image = switch (format) {
                case JPEG -> JPEGFactory.createFromByteArray(document, bytes);
                case PNG -> LosslessFactory.createFromImage(document, readPng(bytes));
            };
            images.add(image);
        } catch (IOException | IllegalArgumentException ex) {
            throw new RenderException("Unable to embed " + format + " image in the PDF.", ex);
        }
        fingerprint.update(bytes);
        return new ImageHandle(images.size() - 1);
    }

    @Override
    public void drawImage(PageHandle page, ImageHandle image, float x, float y, float width, float height) {
        try {
            contentStream(page).drawImage(images.get(image.index()), x, y, width, height);
        } catch (IOException ex) {
            throw new RenderException("Unable to draw image on page " + page.index(), ex);
        }
        fingerprint(String.format(Locale.ROOT, "image|%d|%d|%.3f|%.3f|%.3f|%.3f",
                page.index(), image.index(), x, y, width, height));
    }

    @Override
    public void describe(ReportMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public byte[] save() {
        try (ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            closeContentStreams();
            if (metadata != null) {
                writeInfo(metadata);
                writeXmp(metadata);
            }
            writeDocumentId();
            document.save(output);
            return output.toByteArray();
        } catch (IOException | TransformerException ex) {
            throw new RenderException("Unable to serialize the PDF report.", ex);
        }
    }

    @Override
    public void close() {
        try {
            closeContentStreams();
        } catch (IOException ex) {
            log.warn("Failed to close page content streams", ex);
        }
        try {
            document.close();
        } catch (IOException ex) {
            log.warn("Failed to release PDF document resources", ex);
        }
    }

    private PDPageContentStream contentStream(PageHandle page) {
        if (streamsClosed) {
            throw new IllegalStateException("Document was already serialized.");
        }
        return contentStreams.get(page.index());
    }

    private void closeContentStreams() throws IOException {
        if (streamsClosed) {
            return;
        }
        streamsClosed = true;
        for (PDPageContentStream stream : contentStreams) {
            stream.close();
        }
    }

    private void writeInfo(ReportMetadata metadata) {
        PDDocumentInformation info = document.getDocumentInformation();
        info.setTitle(metadata.title());
        info.setCreator(metadata.creator());
        info.setProducer(PRODUCER);
        info.setCreationDate(toCalendar(metadata));
    }

    private void writeXmp(ReportMetadata metadata) throws IOException, TransformerException {
        XMPMetadata xmp = XMPMetadata.createXMPMetadata();
        DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
        if (metadata.title() != null) {
            dc.setTitle(metadata.title());
        }
        if (metadata.creator() != null) {
            dc.addCreator(metadata.creator());
        }
        XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
        basic.setCreateDate(toCalendar(metadata));
        if (metadata.creator() != null) {
            basic.setCreatorTool(metadata.creator());
        }

        ByteArrayOutputStream packet = new ByteArrayOutputStream();
        new XmpSerializer().serialize(xmp, packet, true);
        PDMetadata pdMetadata = new PDMetadata(document);
        pdMetadata.importXMPMetadata(packet.toByteArray());
        document.getDocumentCatalog().setMetadata(pdMetadata);
    }

    private void writeDocumentId() {
        if (metadata != null && metadata.createdAt() != null) {
            fingerprint("created|" + metadata.createdAt().toEpochMilli());
        }
        byte[] id = fingerprint.digest();
        COSArray idArray = new COSArray();
        idArray.add(new COSString(id));
        idArray.add(new COSString(id));
        document.getDocument().getTrailer().setItem(COSName.ID, idArray);
    }

    private Calendar toCalendar(ReportMetadata metadata) {
        Calendar calendar = new GregorianCalendar(TimeZone.getTimeZone("UTC"), Locale.ROOT);
        if (metadata.createdAt() != null) {
            calendar.setTimeInMillis(metadata.createdAt().toEpochMilli());
        }
        return calendar;
    }

    private BufferedImage readPng(byte[] bytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("No PNG reader accepted the image data.");
        }
        return image;
    }

    private void fingerprint(String value) {
        fingerprint.update(value.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 is required by every Java platform", ex);
        }
    }
}
