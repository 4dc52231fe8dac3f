package com.example.plantreport.domain.model;

import java.util.List;

/**
 * Ordered draw commands of one page.
 */
public record PageLayout(int index, List<DrawCommand> commands) {

    public PageLayout {
        commands = List.copyOf(commands);
    }

    public List<TextLine> textLines() {
        return commands.stream()
                .filter(TextLine.class::isInstance)
                .map(TextLine.class::cast)
                .toList();
    }
}
