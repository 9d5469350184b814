package de.vzg.pubmed.tools.model;

import java.util.List;
import java.util.Objects;

/**
 * A reference to the journal an article appeared in. Full journal records live in the NLM Catalog.
 *
 * @param issnLinking the ISSN used for linking, since a journal may have several
 * @param nlmCatalogId the NLM Catalog identifier of the journal
 * @param issns the ISSNs printed on the article
 */
public record Journal(String issnLinking, String nlmCatalogId, List<Issn> issns) {

    public Journal {
        Objects.requireNonNull(nlmCatalogId, "nlmCatalogId");
        issns = issns == null ? List.of() : List.copyOf(issns);
    }
}
