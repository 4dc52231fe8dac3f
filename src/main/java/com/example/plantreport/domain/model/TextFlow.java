package com.example.plantreport.domain.model;

import java.util.List;

/**
 * Result of planning one block of text.
 *
 * @param pages     pages the block touched, in order, holding only this block's lines
 * @param cursor    position right after the last placed line
 * @param lineCount number of wrapped lines placed
 */
public record TextFlow(List<PageLayout> pages, LayoutCursor cursor, int lineCount) {

    public TextFlow {
        pages = List.copyOf(pages);
    }

    public static TextFlow empty(LayoutCursor cursor) {
        return new TextFlow(List.of(), cursor, 0);
    }

    public List<TextLine> textLines() {
        return pages.stream()
                .flatMap(page -> page.textLines().stream())
                .toList();
    }
}
