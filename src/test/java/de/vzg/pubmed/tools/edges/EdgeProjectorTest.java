package de.vzg.pubmed.tools.edges;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import de.vzg.pubmed.tools.MedlineFixtures;
import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Author;
import de.vzg.pubmed.tools.model.Collective;
import de.vzg.pubmed.tools.model.Heading;
import de.vzg.pubmed.tools.model.Journal;
import de.vzg.pubmed.tools.model.Reference;
import de.vzg.pubmed.tools.model.Triple;

class EdgeProjectorTest {

    private static final Reference SUBJECT = new Reference("pubmed", "12345");

    @Test
    void projectsEveryRelation() {
        Article article = Article.builder(12345, "Test")
            .typeMeshIds(List.of("D016428"))
            .headings(List.of(new Heading("D001943", true, null)))
            .journal(new Journal(null, "100973270", null))
            .authors(List.of(
                new Author("Jane Doe", true, null, "0000-0002-1825-0097"),
                new Author("J Smith", true, null, null),
                new Collective("Study Group", null),
                new Collective("The Test Consortium", new Reference("ror", "000000001"))))
            .citesPubmedIds(List.of("999"))
            .xrefs(List.of(new Reference("doi", "10.1000/test.1")))
            .build();

        Assertions.assertEquals(List.of(
            new Triple(SUBJECT, EdgeProjector.RDF_TYPE, new Reference("mesh", "D016428")),
            new Triple(SUBJECT, EdgeProjector.HAS_TOPIC, new Reference("mesh", "D001943")),
            new Triple(SUBJECT, EdgeProjector.IN_JOURNAL, new Reference("nlm", "100973270")),
            new Triple(SUBJECT, EdgeProjector.HAS_CONTRIBUTOR, new Reference("orcid", "0000-0002-1825-0097")),
            new Triple(SUBJECT, EdgeProjector.HAS_CONTRIBUTOR, new Reference("ror", "000000001")),
            new Triple(SUBJECT, EdgeProjector.CITES, new Reference("pubmed", "999")),
            new Triple(SUBJECT, EdgeProjector.EXACT_MATCH, new Reference("doi", "10.1000/test.1"))),
            EdgeProjector.project(article));
    }

    @Test
    void bareArticleOnlyHasJournal() {
        List<Triple> triples = EdgeProjector.project(MedlineFixtures.article(7));
        Assertions.assertEquals(1, triples.size());
        Assertions.assertEquals("uniprot.core:publishedIn", triples.get(0).predicate().curie());
        Assertions.assertEquals("pubmed:7", triples.get(0).subject().curie());
    }
}
