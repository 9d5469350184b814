package de.vzg.pubmed.tools.model;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An individual author. At least one of name and ORCID is present.
 */
public record Author(String name, boolean valid, List<String> affiliations, String orcid) implements Contributor {

    public static final String ORCID_PREFIX = "orcid";

    public Author {
        affiliations = affiliations == null ? List.of() : List.copyOf(affiliations);
        if (name == null && orcid == null) {
            throw new IllegalArgumentException("An author needs a name or an ORCID");
        }
    }

    @JsonIgnore
    @Override
    public Optional<Reference> identity() {
        return orcid == null ? Optional.empty() : Optional.of(new Reference(ORCID_PREFIX, orcid));
    }
}
