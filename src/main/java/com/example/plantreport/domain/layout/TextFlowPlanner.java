package com.example.plantreport.domain.layout;

import com.example.plantreport.domain.model.DrawCommand;
import com.example.plantreport.domain.model.LayoutConfig;
import com.example.plantreport.domain.model.LayoutCursor;
import com.example.plantreport.domain.model.PageLayout;
import com.example.plantreport.domain.model.TextAlignment;
import com.example.plantreport.domain.model.TextFlow;
import com.example.plantreport.domain.model.TextLine;
import com.example.plantreport.domain.model.TextStyle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns free text into positioned lines, flowing onto as many pages as the text needs.
 * <p>
 * Each logical line (text between newlines) is greedily word-wrapped to the configured column width.
 * A line is placed at the cursor only when at least one line height remains above the bottom margin,
 * otherwise the cursor moves to the top of the next page first. Nothing is dropped and nothing is
 * placed outside {@code [bottomMargin, topMargin]}.
 * <p>
 * Instances are cheap and meant to be created per report.
 */
public class TextFlowPlanner {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final Pattern WORD_SEPARATOR = Pattern.compile(" +");

    private final LayoutConfig config;
    private final FontMetrics metrics;

    public TextFlowPlanner(LayoutConfig config, FontMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

	/**
	 * Plans body text from the top of the first page.
	 *
	 * @param text text to place
	 * @return planned lines and the cursor after the last one
	 */
    public TextFlow plan(String text) {
        return plan(text, config.bodyStyle(), LayoutCursor.start(config));
    }

	/**
	 * Plans text in the given style starting at an arbitrary cursor.
	 *
	 * @param text  text to place, blank text yields an empty flow
	 * @param style font size, line height, colour and alignment of every line
	 * @param start where the first line goes if it fits
	 * @return planned lines grouped by page and the cursor after the last one
	 */
    public TextFlow plan(String text, TextStyle style, LayoutCursor start) {
        if (text == null || text.isBlank()) {
            return TextFlow.empty(start);
        }
        if (style.lineHeight() > config.usableHeight()) {
            throw new IllegalArgumentException("Line height " + style.lineHeight()
                    + " does not fit between the page margins.");
        }

        List<String> lines = wrap(text, style.fontSize());
        Map<Integer, List<DrawCommand>> commandsByPage = new LinkedHashMap<>();
        LayoutCursor cursor = start;
        for (String line : lines) {
            if (!cursor.fits(style.lineHeight(), config)) {
                cursor = cursor.nextPage(config);
            }
            TextLine placed = new TextLine(alignedX(line, style), cursor.y(), line, style.fontSize(), style.color());
            commandsByPage.computeIfAbsent(cursor.pageIndex(), index -> new ArrayList<>()).add(placed);
            cursor = cursor.advance(style.lineHeight());
        }

        List<PageLayout> pages = new ArrayList<>();
        commandsByPage.forEach((index, commands) -> pages.add(new PageLayout(index, commands)));
        return new TextFlow(pages, cursor, lines.size());
    }

	/**
	 * Splits text into logical lines and word-wraps each one to the column width.
	 * A word wider than the column is kept whole on its own line.
	 * Leading spaces of a logical line are kept as indentation; trailing spaces are dropped.
	 *
	 * @param text     raw text
	 * @param fontSize font size used for measuring
	 * @return wrapped lines in reading order, blank logical lines preserved as empty strings
	 */
    public List<String> wrap(String text, float fontSize) {
        List<String> wrapped = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return wrapped;
        }
        for (String logicalLine : LINE_BREAK.split(text.stripTrailing(), -1)) {
            String drawable = metrics.normalize(logicalLine.replace('\t', ' ')).stripTrailing();
            if (drawable.isEmpty()) {
                wrapped.add("");
                continue;
            }
            String words = drawable.stripLeading();
            // continuation lines start flush left
            StringBuilder current = new StringBuilder(drawable.substring(0, drawable.length() - words.length()));
            boolean lineHasWord = false;
            for (String word : WORD_SEPARATOR.split(words)) {
                if (!lineHasWord) {
                    current.append(word);
                    lineHasWord = true;
                    continue;
                }
                String candidate = current + " " + word;
                if (metrics.advanceWidth(candidate, fontSize) > config.maxLineWidth()) {
                    wrapped.add(current.toString());
                    current = new StringBuilder(word);
                } else {
                    current.append(' ').append(word);
                }
            }
            wrapped.add(current.toString());
        }
        return wrapped;
    }

    private float alignedX(String line, TextStyle style) {
        if (style.alignment() != TextAlignment.CENTER || line.isEmpty()) {
            return config.leftMargin();
        }
        float width = metrics.advanceWidth(line, style.fontSize());
        float slack = Math.max(0f, config.maxLineWidth() - width);
        return config.leftMargin() + slack / 2f;
    }
}
