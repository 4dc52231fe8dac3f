package com.example.plantreport.infrastructure.image;

import com.example.plantreport.domain.exception.ImageDecodeException;
import com.example.plantreport.domain.model.DecodedImage;
import com.example.plantreport.domain.model.ImageFormat;
import com.example.plantreport.infrastructure.config.ReportProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Infrastructure service that validates an image against its declared format and reads its pixel size.
 * Only the reader registered for the declared format is tried, so a PNG labelled as JPEG is rejected.
 * The whole image is decoded once, so a valid header followed by a truncated or corrupt body never
 * reaches the document writer. Decoder warnings (libjpeg reports a premature end of data this way)
 * count as failures.
 */
@Service
public class ImageIoDimensionReader {

    private static final Logger log = LoggerFactory.getLogger(ImageIoDimensionReader.class);

    private final long maxPixels;

    @Autowired
    public ImageIoDimensionReader(ReportProperties properties) {
        this(properties.getMaxImagePixels());
    }

	/**
	 * @param maxPixels largest accepted {@code width * height}, checked before the body is decoded
	 */
    public ImageIoDimensionReader(long maxPixels) {
        if (maxPixels <= 0) {
            throw new IllegalArgumentException("Pixel limit must be positive.");
        }
        this.maxPixels = maxPixels;
    }

	/**
	 * Decodes the image with the reader of the declared format.
	 *
	 * @param bytes  raw image payload
	 * @param format format declared by the caller
	 * @return image with its natural size
	 * @throws ImageDecodeException when the payload is empty, too large or not fully readable as {@code format}
	 */
    public DecodedImage read(byte[] bytes, ImageFormat format) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("The image payload is empty.");
        }
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(format.readerFormatName());
        if (!readers.hasNext()) {
            throw new ImageDecodeException("No decoder available for " + format.mimeType() + ".");
        }

        ImageReader reader = readers.next();
        List<String> warnings = new ArrayList<>();
        reader.addIIOReadWarningListener((source, warning) -> warnings.add(warning));
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            reader.setInput(input, true, true);
            int width = reader.getWidth(0);
            int height = reader.getHeight(0);
            checkSize(width, height);
            reader.read(0);
            if (!warnings.isEmpty()) {
                throw new ImageDecodeException("The image data is damaged: " + warnings.get(0)
                        + ". Please verify that it is a valid " + format + " file.");
            }
            log.debug("Decoded {} image of {}x{} px ({} bytes)", format, width, height, bytes.length);
            return new DecodedImage(bytes, format, width, height);
        } catch (ImageDecodeException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new ImageDecodeException("The image could not be decoded as " + format.mimeType()
                    + ". Please verify that it is a valid JPEG or PNG file.", ex);
        } finally {
            reader.dispose();
        }
    }

    private void checkSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new ImageDecodeException("The image reports an empty size.");
        }
        if ((long) width * height > maxPixels) {
            throw new ImageDecodeException("The image is " + width + "x" + height
                    + " pixels, more than the " + maxPixels + " pixels a report accepts.");
        }
    }
}
