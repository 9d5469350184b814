package de.vzg.pubmed.tools.model;

import java.util.Objects;

public record History(HistoryStatus status, PartialDate date) {

    public History {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(date, "date");
    }
}
