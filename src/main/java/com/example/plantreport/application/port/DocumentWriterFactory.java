package com.example.plantreport.application.port;

import com.example.plantreport.domain.layout.FontMetrics;

/**
 * Creates request-scoped writers and the matching font metrics for planning.
 */
public interface DocumentWriterFactory {

	/**
	 * @return a writer holding a new, empty document
	 */
    DocumentWriter create();

	/**
	 * @param family font family the writer will embed for the same report
	 * @return metrics measuring text exactly as the writer will draw it
	 */
    FontMetrics fontMetrics(String family);
}
