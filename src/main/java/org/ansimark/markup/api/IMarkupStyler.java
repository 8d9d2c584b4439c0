package org.ansimark.markup.api;

import org.ansimark.markup.diagnostics.DiagnosticsEngine;

/**
 * Defines the public interface for turning tagged markup into ANSI-styled text.
 */
public interface IMarkupStyler {

    /**
     * Renders the given markup. Non-fatal diagnostics are logged.
     *
     * @param markup The markup to render.
     * @return The text with all phrases replaced by their styled content.
     * @throws MarkupException if the markup is ill-formed or asks for styles that were not supplied.
     */
    String render(String markup) throws MarkupException;

    /**
     * Renders the given markup, reporting non-fatal diagnostics to the given engine.
     *
     * @param markup The markup to render.
     * @param diagnostics The engine collecting warnings such as unmatched closing tags.
     * @return The styled text.
     * @throws MarkupException if the markup is ill-formed or asks for styles that were not supplied.
     */
    String render(String markup, DiagnosticsEngine diagnostics) throws MarkupException;
}
