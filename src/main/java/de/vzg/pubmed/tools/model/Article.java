package de.vzg.pubmed.tools.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A canonical PubMed article, extracted once from a {@code PubmedArticle} element and never modified.
 *
 * @param pubmed the PMID, unique within one source file
 * @param title the article title
 * @param dateCompleted the date MEDLINE indexing was completed
 * @param dateRevised the date the citation was last revised
 * @param typeMeshIds MeSH identifiers of the publication types, sorted
 * @param headings MeSH heading annotations in source order
 * @param journal the journal the article appeared in
 * @param journalIssue the issue the article appeared in
 * @param abstractTexts abstract segments in source order
 * @param authors contributors in source order
 * @param citesPubmedIds PMIDs of cited articles
 * @param xrefs identifiers of the same article in other schemes (DOI, PMC, ...)
 * @param history publication status history, duplicates kept
 * @param grants grants that funded the work
 */
public record Article(
    int pubmed,
    String title,
    PartialDate dateCompleted,
    PartialDate dateRevised,
    List<String> typeMeshIds,
    List<Heading> headings,
    Journal journal,
    JournalIssue journalIssue,
    List<AbstractText> abstractTexts,
    List<Contributor> authors,
    List<String> citesPubmedIds,
    List<Reference> xrefs,
    List<History> history,
    List<Grant> grants) {

    public static final String PUBMED_PREFIX = "pubmed";

    /**
     * MeSH publication type "Retracted Publication".
     */
    public static final String RETRACTED_PUBLICATION = "D016441";

    public Article {
        if (pubmed <= 0) {
            throw new IllegalArgumentException("PMID must be positive: " + pubmed);
        }
        if (title == null || title.isEmpty()) {
            throw new IllegalArgumentException("[pubmed:" + pubmed + "] title must not be empty");
        }
        Objects.requireNonNull(journal, "journal");
        journalIssue = journalIssue == null ? JournalIssue.EMPTY : journalIssue;
        typeMeshIds = copy(typeMeshIds);
        headings = copy(headings);
        abstractTexts = copy(abstractTexts);
        authors = copy(authors);
        citesPubmedIds = copy(citesPubmedIds);
        xrefs = copy(xrefs);
        history = copy(history);
        grants = copy(grants);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    @JsonIgnore
    public Reference reference() {
        return new Reference(PUBMED_PREFIX, Integer.toString(pubmed));
    }

    @JsonIgnore
    public PartialDate datePublished() {
        return journalIssue.published();
    }

    /**
     * @return all abstract segments joined by a single space, empty if there is no abstract
     */
    public String fullAbstract() {
        return abstractTexts.stream().map(AbstractText::text).collect(Collectors.joining(" "));
    }

    @JsonIgnore
    public boolean isRetracted() {
        return typeMeshIds.contains(RETRACTED_PUBLICATION);
    }

    public static Builder builder(int pubmed, String title) {
        return new Builder(pubmed, title);
    }

    /**
     * Collects the parts of an article while it is being extracted.
     */
    public static final class Builder {
        private final int pubmed;
        private final String title;
        private PartialDate dateCompleted;
        private PartialDate dateRevised;
        private List<String> typeMeshIds = List.of();
        private List<Heading> headings = List.of();
        private Journal journal;
        private JournalIssue journalIssue = JournalIssue.EMPTY;
        private List<AbstractText> abstractTexts = List.of();
        private List<Contributor> authors = List.of();
        private List<String> citesPubmedIds = List.of();
        private List<Reference> xrefs = List.of();
        private List<History> history = List.of();
        private List<Grant> grants = List.of();

        private Builder(int pubmed, String title) {
            this.pubmed = pubmed;
            this.title = title;
        }

        public Builder dateCompleted(PartialDate dateCompleted) {
            this.dateCompleted = dateCompleted;
            return this;
        }

        public Builder dateRevised(PartialDate dateRevised) {
            this.dateRevised = dateRevised;
            return this;
        }

        public Builder typeMeshIds(List<String> typeMeshIds) {
            this.typeMeshIds = typeMeshIds;
            return this;
        }

        public Builder headings(List<Heading> headings) {
            this.headings = headings;
            return this;
        }

        public Builder journal(Journal journal) {
            this.journal = journal;
            return this;
        }

        public Builder journalIssue(JournalIssue journalIssue) {
            this.journalIssue = journalIssue;
            return this;
        }

        public Builder abstractTexts(List<AbstractText> abstractTexts) {
            this.abstractTexts = abstractTexts;
            return this;
        }

        public Builder authors(List<Contributor> authors) {
            this.authors = authors;
            return this;
        }

        public Builder citesPubmedIds(List<String> citesPubmedIds) {
            this.citesPubmedIds = citesPubmedIds;
            return this;
        }

        public Builder xrefs(List<Reference> xrefs) {
            this.xrefs = xrefs;
            return this;
        }

        public Builder history(List<History> history) {
            this.history = history;
            return this;
        }

        public Builder grants(List<Grant> grants) {
            this.grants = grants;
            return this;
        }

        public Article build() {
            return new Article(pubmed, title, dateCompleted, dateRevised, typeMeshIds, headings, journal,
                journalIssue, abstractTexts, authors, citesPubmedIds, xrefs, history, grants);
        }
    }
}
