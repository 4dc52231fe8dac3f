package com.example.plantreport.domain.model;

/**
 * Horizontal placement of a line inside the text column.
 */
public enum TextAlignment {
    LEFT,
    CENTER
}
