package de.vzg.pubmed.tools.model;

import java.util.Objects;

/**
 * One segment of a (possibly structured) abstract.
 *
 * @param text the segment text
 * @param label the section label, e.g. {@code BACKGROUND}
 * @param category the NLM category, e.g. {@code METHODS}
 */
public record AbstractText(String text, String label, String category) {

    public AbstractText {
        Objects.requireNonNull(text, "text");
    }
}
