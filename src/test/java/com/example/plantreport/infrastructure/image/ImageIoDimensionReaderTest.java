package com.example.plantreport.infrastructure.image;

import com.example.plantreport.TestImages;
import com.example.plantreport.domain.exception.ImageDecodeException;
import com.example.plantreport.domain.model.DecodedImage;
import com.example.plantreport.domain.model.ImageFormat;
import com.example.plantreport.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ImageIoDimensionReaderTest {

    private final ImageIoDimensionReader reader = new ImageIoDimensionReader(new ReportProperties());

    @Test
    void readsNaturalSizeOfPngAndJpeg() {
        DecodedImage png = reader.read(TestImages.png(640, 480), ImageFormat.PNG);
        DecodedImage jpeg = reader.read(TestImages.jpeg(33, 77), ImageFormat.JPEG);

        assertThat(png.pixelWidth()).isEqualTo(640);
        assertThat(png.pixelHeight()).isEqualTo(480);
        assertThat(png.format()).isEqualTo(ImageFormat.PNG);
        assertThat(jpeg.pixelWidth()).isEqualTo(33);
        assertThat(jpeg.pixelHeight()).isEqualTo(77);
    }

    /**
     * The declared format decides which decoder runs.
     */
    @Test
    void pngDeclaredAsJpegIsRejected() {
        assertThrows(ImageDecodeException.class, () -> reader.read(TestImages.png(10, 10), ImageFormat.JPEG));
    }

    @Test
    void garbageAndEmptyPayloadsAreRejected() {
        byte[] garbage = "not an image at all".getBytes(StandardCharsets.US_ASCII);

        assertThrows(ImageDecodeException.class, () -> reader.read(garbage, ImageFormat.PNG));
        assertThrows(ImageDecodeException.class, () -> reader.read(new byte[0], ImageFormat.PNG));
        assertThrows(ImageDecodeException.class, () -> reader.read(null, ImageFormat.JPEG));
    }

    @Test
    void truncatedJpegBodyIsRejected() {
        byte[] jpeg = TestImages.jpeg(400, 300);

        assertThrows(ImageDecodeException.class,
                () -> reader.read(TestImages.truncated(jpeg, jpeg.length / 3), ImageFormat.JPEG));
        assertThrows(ImageDecodeException.class,
                () -> reader.read(TestImages.truncated(jpeg, jpeg.length - 200), ImageFormat.JPEG));
    }

    @Test
    void truncatedPngBodyIsRejected() {
        byte[] png = TestImages.png(400, 300);

        assertThrows(ImageDecodeException.class,
                () -> reader.read(TestImages.truncated(png, 40), ImageFormat.PNG));
        assertThrows(ImageDecodeException.class,
                () -> reader.read(TestImages.truncated(png, png.length / 2), ImageFormat.PNG));
    }

    @Test
    void sizeAboveLimitIsRejectedBeforeDecoding() {
        ImageDecodeException error = assertThrows(ImageDecodeException.class,
                () -> reader.read(TestImages.pngHeaderOnly(60000, 60000), ImageFormat.PNG));
        assertThat(error.getMessage()).contains("60000x60000");

        ImageIoDimensionReader strict = new ImageIoDimensionReader(100);
        assertThrows(ImageDecodeException.class, () -> strict.read(TestImages.png(11, 10), ImageFormat.PNG));
        assertThat(strict.read(TestImages.png(10, 10), ImageFormat.PNG).pixelWidth()).isEqualTo(10);
    }
}
