package de.vzg.pubmed.tools.model;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A group author, e.g. a consortium or study group.
 */
public record Collective(String name, Reference reference) implements Contributor {

    public Collective {
        Objects.requireNonNull(name, "name");
    }

    @JsonIgnore
    @Override
    public Optional<Reference> identity() {
        return Optional.ofNullable(reference);
    }
}
