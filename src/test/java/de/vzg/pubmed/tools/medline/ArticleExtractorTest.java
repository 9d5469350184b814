package de.vzg.pubmed.tools.medline;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import de.vzg.pubmed.tools.MedlineFixtures;
import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Issn;
import de.vzg.pubmed.tools.model.IssnType;

class ArticleExtractorTest {

    private final ArticleExtractor extractor = new ArticleExtractor();

    @Test
    void minimalRecord() {
        Article article = extractor.extract(MedlineFixtures.element(MedlineFixtures.record(12345, "Test")))
            .orElseThrow();
        Assertions.assertEquals(12345, article.pubmed());
        Assertions.assertEquals("Test", article.title());
        Assertions.assertEquals("100973270", article.journal().nlmCatalogId());
        Assertions.assertEquals(List.of(new Issn("1234-5678", IssnType.PRINT)), article.journal().issns());
        Assertions.assertTrue(article.headings().isEmpty());
        Assertions.assertTrue(article.authors().isEmpty());
        Assertions.assertNull(article.dateCompleted());
        Assertions.assertNull(article.datePublished());
    }

    @Test
    void missingPmidIsStructural() {
        Assertions.assertThrows(MedlineStructureException.class, () -> extractor.extract(MedlineFixtures.element(
            "<PubmedArticle><MedlineCitation><Article><ArticleTitle>T</ArticleTitle></Article></MedlineCitation>"
                + "<PubmedData/></PubmedArticle>")));
    }

    @Test
    void emptyPmidIsStructural() {
        Assertions.assertThrows(MedlineStructureException.class, () -> extractor.extract(MedlineFixtures.element(
            "<PubmedArticle><MedlineCitation><PMID> </PMID><Article><ArticleTitle>T</ArticleTitle></Article>"
                + "</MedlineCitation><PubmedData/></PubmedArticle>")));
    }

    @Test
    void nonNumericPmidIsStructural() {
        Assertions.assertThrows(MedlineStructureException.class, () -> extractor.extract(MedlineFixtures.element(
            "<PubmedArticle><MedlineCitation><PMID>abc</PMID><Article><ArticleTitle>T</ArticleTitle></Article>"
                + "</MedlineCitation><PubmedData/></PubmedArticle>")));
    }

    @Test
    void missingMedlineCitationIsStructural() {
        Assertions.assertThrows(MedlineStructureException.class,
            () -> extractor.extract(MedlineFixtures.element("<PubmedArticle><PubmedData/></PubmedArticle>")));
    }

    @Test
    void missingTitleTagIsStructural() {
        MedlineStructureException e = Assertions.assertThrows(MedlineStructureException.class,
            () -> extractor.extract(MedlineFixtures.element("<PubmedArticle><MedlineCitation><PMID>7</PMID>"
                + "<Article/></MedlineCitation><PubmedData/></PubmedArticle>")));
        Assertions.assertEquals(7, e.getPubmed());
    }

    @Test
    void missingPubmedDataIsStructural() {
        String xml = MedlineFixtures.record(7, "Title").replace("<PubmedData/>", "");
        Assertions.assertThrows(MedlineStructureException.class,
            () -> extractor.extract(MedlineFixtures.element(xml)));
    }

    @Test
    void emptyTitleIsSkipped() {
        Assertions.assertEquals(Optional.empty(),
            extractor.extract(MedlineFixtures.element(MedlineFixtures.record(7, ""))));
    }

    @Test
    void missingJournalIdentifierIsSkipped() {
        String xml = MedlineFixtures.record(7, "Title")
            .replace("<NlmUniqueID>" + MedlineFixtures.NLM_CATALOG_ID + "</NlmUniqueID>", "");
        Assertions.assertEquals(Optional.empty(), extractor.extract(MedlineFixtures.element(xml)));
    }

    @Test
    void invalidHeadingCarriesPmid() {
        String xml = MedlineFixtures.record(7, "Title").replace("</MedlineCitation>",
            "<MeshHeadingList><MeshHeading><DescriptorName UI=\"D006801\" MajorTopicYN=\"?\">Humans</DescriptorName>"
                + "</MeshHeading></MeshHeadingList></MedlineCitation>");
        MedlineStructureException e = Assertions.assertThrows(MedlineStructureException.class,
            () -> extractor.extract(MedlineFixtures.element(xml)));
        Assertions.assertEquals(7, e.getPubmed());
        Assertions.assertTrue(e.getMessage().startsWith("[pubmed:7]"), e.getMessage());
    }
}
