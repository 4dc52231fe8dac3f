package com.example.plantreport.application.service;

import com.example.plantreport.domain.layout.FontMetrics;
import com.example.plantreport.domain.layout.ImagePlacementResolver;
import com.example.plantreport.domain.layout.TextFlowPlanner;
import com.example.plantreport.domain.model.DecodedImage;
import com.example.plantreport.domain.model.DocumentLayout;
import com.example.plantreport.domain.model.ImagePlacement;
import com.example.plantreport.domain.model.LayoutConfig;
import com.example.plantreport.domain.model.LayoutCursor;
import com.example.plantreport.domain.model.RgbColor;
import com.example.plantreport.domain.model.TextAlignment;
import com.example.plantreport.domain.model.TextFlow;
import com.example.plantreport.domain.model.TextStyle;

/**
 * Chains the heading, the analysis text and the image into one {@link DocumentLayout}.
 * Created per report; holds the planner and resolver configured for that report.
 */
public class ReportLayoutComposer {

    static final TextStyle TITLE_STYLE = new TextStyle(20f, 30f, new RgbColor(0.2f, 0.4f, 0.6f), TextAlignment.CENTER);
    static final TextStyle DATE_STYLE = new TextStyle(14f, 20f, RgbColor.BLACK, TextAlignment.LEFT);

    private final LayoutConfig config;
    private final String fontFamily;
    private final TextFlowPlanner planner;
    private final ImagePlacementResolver resolver;

    public ReportLayoutComposer(LayoutConfig config, FontMetrics metrics, String fontFamily) {
        this.config = config;
        this.fontFamily = fontFamily;
        this.planner = new TextFlowPlanner(config, metrics);
        this.resolver = new ImagePlacementResolver(config);
    }

	/**
	 * Plans the full report.
	 *
	 * @param heading optional title and date lines, {@code null} to start directly with the text
	 * @param text    analysis text, may be blank
	 * @param image   optional image placed after the text
	 * @param scale   image scale factor
	 * @return planned document
	 */
    public DocumentLayout compose(ReportHeading heading, String text, DecodedImage image, double scale) {
        DocumentLayout.Builder builder = DocumentLayout.builder(config, fontFamily);
        LayoutCursor cursor = LayoutCursor.start(config);

        if (heading != null) {
            TextFlow title = planner.plan(heading.title(), TITLE_STYLE, cursor);
            TextFlow date = planner.plan(heading.dateLine(), DATE_STYLE, title.cursor());
            builder.add(title).add(date);
            cursor = date.cursor();
        }

        TextFlow body = planner.plan(text, config.bodyStyle(), cursor);
        builder.add(body);
        cursor = body.cursor();

        if (image != null) {
            ImagePlacement placement = resolver.place(image.pixelWidth(), image.pixelHeight(), scale, cursor);
            builder.add(placement.pageIndex(), placement.toDrawCommand(image));
        }
        return builder.build();
    }

	/**
	 * Title and date printed above the analysis text on the first page.
	 */
    public record ReportHeading(String title, String dateLine) {
    }
}
