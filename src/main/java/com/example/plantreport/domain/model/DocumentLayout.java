package com.example.plantreport.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fully planned document: page geometry, the single font shared by every page and the pages in order.
 * Built once per report and handed to the renderer.
 */
public record DocumentLayout(
        float pageWidth,
        float pageHeight,
        String fontFamily,
        List<PageLayout> pages
) {

    public DocumentLayout {
        pages = List.copyOf(pages);
    }

    public int pageCount() {
        return pages.size();
    }

    public List<TextLine> textLines() {
        return pages.stream()
                .flatMap(page -> page.textLines().stream())
                .toList();
    }

    public static Builder builder(LayoutConfig config, String fontFamily) {
        return new Builder(config, fontFamily);
    }

	/**
	 * Accumulates commands by page index in the order they are appended.
	 */
    public static final class Builder {

        private final LayoutConfig config;
        private final String fontFamily;
        private final Map<Integer, List<DrawCommand>> commandsByPage = new TreeMap<>();

        private Builder(LayoutConfig config, String fontFamily) {
            this.config = config;
            this.fontFamily = fontFamily;
        }

        public Builder add(TextFlow flow) {
            for (PageLayout page : flow.pages()) {
                page.commands().forEach(command -> add(page.index(), command));
            }
            return this;
        }

        public Builder add(int pageIndex, DrawCommand command) {
            commandsByPage.computeIfAbsent(pageIndex, index -> new ArrayList<>()).add(command);
            return this;
        }

		/**
		 * @return layout whose pages are numbered {@code 0..n-1} without gaps
		 * @throws IllegalStateException when a page index was skipped while planning
		 */
        public DocumentLayout build() {
            List<PageLayout> pages = new ArrayList<>();
            int expected = 0;
            for (Map.Entry<Integer, List<DrawCommand>> entry : commandsByPage.entrySet()) {
                if (entry.getKey() != expected) {
                    throw new IllegalStateException("Planned pages are not contiguous: missing page " + expected);
                }
                pages.add(new PageLayout(entry.getKey(), entry.getValue()));
                expected++;
            }
            return new DocumentLayout(config.pageWidth(), config.pageHeight(), fontFamily, pages);
        }
    }
}
