package de.vzg.pubmed.tools.model;

/**
 * The issue of a journal in which an article was published. Issue labels are free text ("1-2", "Suppl 3").
 */
public record JournalIssue(String volume, String issue, PartialDate published) {

    public static final JournalIssue EMPTY = new JournalIssue(null, null, null);
}
