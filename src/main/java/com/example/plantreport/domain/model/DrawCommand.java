package com.example.plantreport.domain.model;

/**
 * One drawing instruction on a page. Implementations are immutable once appended to a {@link PageLayout}.
 */
public interface DrawCommand {

    float x();

    float y();
}
