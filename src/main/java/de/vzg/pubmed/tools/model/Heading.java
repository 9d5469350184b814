package de.vzg.pubmed.tools.model;

import java.util.List;
import java.util.Objects;

/**
 * A MeSH heading annotation.
 *
 * @param descriptor the MeSH descriptor identifier, e.g. {@code D001943}
 * @param major whether the descriptor is a major topic of the article
 * @param qualifiers the qualifiers in source order, or {@code null} if the heading has none
 */
public record Heading(String descriptor, boolean major, List<Qualifier> qualifiers) {

    public Heading {
        Objects.requireNonNull(descriptor, "descriptor");
        qualifiers = qualifiers == null || qualifiers.isEmpty() ? null : List.copyOf(qualifiers);
    }
}
