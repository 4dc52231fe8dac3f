package com.example.plantreport.infrastructure.pdf;

import com.example.plantreport.application.port.DocumentWriter;
import com.example.plantreport.application.port.DocumentWriterFactory;
import com.example.plantreport.domain.layout.FontMetrics;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh PDFBox document and font per report so concurrent requests share nothing.
 */
@Component
public class PdfBoxDocumentWriterFactory implements DocumentWriterFactory {

    @Override
    public DocumentWriter create() {
        return new PdfBoxDocumentWriter();
    }

    @Override
    public FontMetrics fontMetrics(String family) {
        return PdfBoxFontMetrics.forFamily(family);
    }
}
