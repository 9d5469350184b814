package de.vzg.pubmed.tools.model;

import java.util.Objects;

public record Issn(String value, IssnType type) {

    public Issn {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");
    }
}
