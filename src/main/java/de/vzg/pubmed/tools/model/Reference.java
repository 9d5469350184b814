package de.vzg.pubmed.tools.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A prefixed identifier, written as a CURIE ({@code prefix:identifier}).
 */
public record Reference(String prefix, String identifier) {

    public Reference {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(identifier, "identifier");
        if (prefix.isEmpty() || prefix.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Invalid prefix: '" + prefix + "'");
        }
    }

    /**
     * Parses a CURIE. The prefix ends at the first colon, the identifier may contain further colons.
     *
     * @param curie text of the form {@code prefix:identifier}
     * @return the parsed reference
     * @throws IllegalArgumentException if the text has no prefix
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Reference fromCurie(String curie) {
        int colon = curie == null ? -1 : curie.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Not a CURIE: '" + curie + "'");
        }
        return new Reference(curie.substring(0, colon), curie.substring(colon + 1));
    }

    @JsonValue
    public String curie() {
        return prefix + ":" + identifier;
    }

    @Override
    public String toString() {
        return curie();
    }
}
