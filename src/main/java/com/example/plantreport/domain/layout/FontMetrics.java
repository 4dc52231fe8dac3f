package com.example.plantreport.domain.layout;

/**
 * Font measurements the planner needs to wrap text the same way the writer will draw it.
 */
public interface FontMetrics {

	/**
	 * Measures the advance width of a string.
	 *
	 * @param text     text already passed through {@link #normalize(String)}
	 * @param fontSize font size in points
	 * @return width in points
	 */
    float advanceWidth(String text, float fontSize);

	/**
	 * Replaces characters the font cannot draw so that measured text and drawn text are identical.
	 *
	 * @param text raw text
	 * @return drawable text of the same logical content
	 */
    String normalize(String text);
}
