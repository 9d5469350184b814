package de.vzg.pubmed.tools.model;

import java.util.Objects;

public record Triple(Reference subject, Reference predicate, Reference object) {

    public Triple {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(object, "object");
    }
}
