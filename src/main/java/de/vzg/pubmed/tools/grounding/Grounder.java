package de.vzg.pubmed.tools.grounding;

import java.util.Optional;

import de.vzg.pubmed.tools.model.Reference;

/**
 * Resolves free text to a canonical reference. Implementations are built once and shared between
 * worker threads, so they must be safe for concurrent reads.
 */
@FunctionalInterface
public interface Grounder {

    /**
     * @param text the text to ground, e.g. an agency name
     * @return the best matching reference, or empty if nothing matches
     */
    Optional<Reference> resolve(String text);
}
