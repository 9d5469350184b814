package de.vzg.pubmed.tools.model;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Publication status values of a {@code PubMedPubDate} history entry.
 */
public enum HistoryStatus {
    RECEIVED("received"),
    ACCEPTED("accepted"),
    PUBMED("pubmed"),
    MEDLINE("medline"),
    ENTREZ("entrez"),
    PMC_RELEASE("pmc-release"),
    REVISED("revised"),
    AHEAD_OF_PRINT("aheadofprint"),
    RETRACTED("retracted"),
    ECOLLECTION("ecollection");

    private final String value;

    HistoryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<HistoryStatus> find(String value) {
        for (HistoryStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static HistoryStatus fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown history status: " + value));
    }
}
