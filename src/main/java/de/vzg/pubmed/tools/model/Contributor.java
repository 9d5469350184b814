package de.vzg.pubmed.tools.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A contributor to an article. The set of variants is closed: either an individual {@link Author} or a
 * {@link Collective} group.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Author.class, name = "author"),
    @JsonSubTypes.Type(value = Collective.class, name = "collective")
})
public sealed interface Contributor permits Author, Collective {

    /**
     * @return the identity that makes this contributor assertable as a graph node, if any
     */
    Optional<Reference> identity();
}
