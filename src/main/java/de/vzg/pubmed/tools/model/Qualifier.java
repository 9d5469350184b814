package de.vzg.pubmed.tools.model;

import java.util.Objects;

public record Qualifier(String mesh, boolean major) {

    public Qualifier {
        Objects.requireNonNull(mesh, "mesh");
    }
}
