package de.vzg.pubmed.tools.edges;

import java.util.ArrayList;
import java.util.List;

import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Contributor;
import de.vzg.pubmed.tools.model.Heading;
import de.vzg.pubmed.tools.model.Reference;
import de.vzg.pubmed.tools.model.Triple;

/**
 * Derives graph statements from an article. The predicate vocabulary is fixed.
 */
public final class EdgeProjector {

    public static final Reference RDF_TYPE = new Reference("rdf", "type");
    // also see edam:has_topic
    public static final Reference HAS_TOPIC = new Reference("biolink", "has_topic");
    // also see biolink:published_in, EFO:0001796
    public static final Reference IN_JOURNAL = new Reference("uniprot.core", "publishedIn");
    public static final Reference HAS_CONTRIBUTOR = new Reference("dcterms", "contributor");
    public static final Reference CITES = new Reference("cito", "cites");
    public static final Reference EXACT_MATCH = new Reference("skos", "exactMatch");

    public static final String MESH_PREFIX = "mesh";
    public static final String NLM_PREFIX = "nlm";

    private EdgeProjector() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Statements, in this order: one type per publication type, one topic per heading, the journal, one
     * contributor per author or collective with an identity (others are left out), one citation per cited
     * PMID and one exact match per cross reference.
     *
     * @param article the article
     * @return the statements, all with the article as subject
     */
    public static List<Triple> project(Article article) {
        Reference subject = article.reference();
        List<Triple> triples = new ArrayList<>();
        for (String typeMeshId : article.typeMeshIds()) {
            triples.add(new Triple(subject, RDF_TYPE, new Reference(MESH_PREFIX, typeMeshId)));
        }
        for (Heading heading : article.headings()) {
            triples.add(new Triple(subject, HAS_TOPIC, new Reference(MESH_PREFIX, heading.descriptor())));
        }
        triples.add(new Triple(subject, IN_JOURNAL, new Reference(NLM_PREFIX, article.journal().nlmCatalogId())));
        for (Contributor contributor : article.authors()) {
            contributor.identity()
                .ifPresent(reference -> triples.add(new Triple(subject, HAS_CONTRIBUTOR, reference)));
        }
        for (String cited : article.citesPubmedIds()) {
            triples.add(new Triple(subject, CITES, new Reference(Article.PUBMED_PREFIX, cited)));
        }
        for (Reference xref : article.xrefs()) {
            triples.add(new Triple(subject, EXACT_MATCH, xref));
        }
        return triples;
    }
}
