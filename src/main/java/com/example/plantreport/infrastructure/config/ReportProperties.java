package com.example.plantreport.infrastructure.config;

import com.example.plantreport.domain.model.LayoutConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Externalized report settings bound from the {@code report.*} keys of {@code application.yml}.
 * Defaults reproduce the A4 layout the service has always produced.
 */
@Component
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

    private String storageDir = "reports";
    private String fontFamily = "HELVETICA";
    private String title = "Plant Analysis Report";
    private String creator = "plant-report";
    private double defaultScale = 0.5d;
    private boolean headingEnabled = true;
    private String datePattern = "yyyy-MM-dd";
    private long maxImagePixels = 40_000_000L;
    private Layout layout = new Layout();

    public String getStorageDir() {
        return storageDir;
    }

    public void setStorageDir(String storageDir) {
        this.storageDir = storageDir;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public void setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCreator() {
        return creator;
    }

    public void setCreator(String creator) {
        this.creator = creator;
    }

    public double getDefaultScale() {
        return defaultScale;
    }

    public void setDefaultScale(double defaultScale) {
        this.defaultScale = defaultScale;
    }

    public boolean isHeadingEnabled() {
        return headingEnabled;
    }

    public void setHeadingEnabled(boolean headingEnabled) {
        this.headingEnabled = headingEnabled;
    }

    public String getDatePattern() {
        return datePattern;
    }

    public void setDatePattern(String datePattern) {
        this.datePattern = datePattern;
    }

    public long getMaxImagePixels() {
        return maxImagePixels;
    }

    public void setMaxImagePixels(long maxImagePixels) {
        this.maxImagePixels = maxImagePixels;
    }

    public Layout getLayout() {
        return layout;
    }

    public void setLayout(Layout layout) {
        this.layout = layout;
    }

	/**
	 * Page geometry in PDF points, origin bottom-left.
	 */
    public static class Layout {

        private float pageWidth = LayoutConfig.A4_WIDTH;
        private float pageHeight = LayoutConfig.A4_HEIGHT;
        private float leftMargin = 50f;
        private float topMargin = 800f;
        private float bottomMargin = 50f;
        private float maxLineWidth = 500f;
        private float fontSize = 12f;
        private float lineHeight = 18f;
        private float imageGap = 20f;

		/**
		 * Builds a validated, immutable layout for one report.
		 *
		 * @return layout configuration
		 * @throws IllegalArgumentException when the configured values are inconsistent
		 */
        public LayoutConfig toLayoutConfig() {
            return new LayoutConfig(pageWidth, pageHeight, leftMargin, topMargin, bottomMargin,
                    maxLineWidth, fontSize, lineHeight, imageGap);
        }

        public float getPageWidth() {
            return pageWidth;
        }

        public void setPageWidth(float pageWidth) {
            this.pageWidth = pageWidth;
        }

        public float getPageHeight() {
            return pageHeight;
        }

        public void setPageHeight(float pageHeight) {
            this.pageHeight = pageHeight;
        }

        public float getLeftMargin() {
            return leftMargin;
        }

        public void setLeftMargin(float leftMargin) {
            this.leftMargin = leftMargin;
        }

        public float getTopMargin() {
            return topMargin;
        }

        public void setTopMargin(float topMargin) {
            this.topMargin = topMargin;
        }

        public float getBottomMargin() {
            return bottomMargin;
        }

        public void setBottomMargin(float bottomMargin) {
            this.bottomMargin = bottomMargin;
        }

        public float getMaxLineWidth() {
            return maxLineWidth;
        }

        public void setMaxLineWidth(float maxLineWidth) {
            this.maxLineWidth = maxLineWidth;
        }

        public float getFontSize() {
            return fontSize;
        }

        public void setFontSize(float fontSize) {
            this.fontSize = fontSize;
        }

        public float getLineHeight() {
            return lineHeight;
        }

        public void setLineHeight(float lineHeight) {
            this.lineHeight = lineHeight;
        }

        public float getImageGap() {
            return imageGap;
        }

        public void setImageGap(float imageGap) {
            this.imageGap = imageGap;
        }
    }
}
