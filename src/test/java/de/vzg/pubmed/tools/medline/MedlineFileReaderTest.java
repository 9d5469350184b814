package de.vzg.pubmed.tools.medline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.jdom2.JDOMException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.vzg.pubmed.tools.MedlineFixtures;
import de.vzg.pubmed.tools.model.AbstractText;
import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Author;
import de.vzg.pubmed.tools.model.Collective;
import de.vzg.pubmed.tools.model.Heading;
import de.vzg.pubmed.tools.model.HistoryStatus;
import de.vzg.pubmed.tools.model.Issn;
import de.vzg.pubmed.tools.model.IssnType;
import de.vzg.pubmed.tools.model.PartialDate;
import de.vzg.pubmed.tools.model.Qualifier;
import de.vzg.pubmed.tools.model.Reference;

class MedlineFileReaderTest {

    private final MedlineFileReader reader = new MedlineFileReader(new ArticleExtractor());

    @TempDir
    Path tempDir;

    @Test
    void readSample() throws IOException, JDOMException {
        List<Article> articles = reader.read(MedlineFixtures.copySample(tempDir, "pubmed25n0001.xml"));

        // 222 has no title, 333 a broken heading, 444 no journal information
        Assertions.assertEquals(1, articles.size());
        Article article = articles.get(0);

        Assertions.assertEquals(12345, article.pubmed());
        Assertions.assertEquals("Test", article.title());
        Assertions.assertEquals(PartialDate.of(2020, 3, 15), article.dateCompleted());
        Assertions.assertEquals(PartialDate.of(2021, 2, 10), article.dateRevised());
        Assertions.assertEquals(List.of("D016428", "D016454"), article.typeMeshIds());
        Assertions.assertEquals(List.of(
            new Heading("D001943", true, List.of(new Qualifier("Q000235", false))),
            new Heading("D006801", false, null)), article.headings());

        Assertions.assertEquals("1234-5678", article.journal().issnLinking());
        Assertions.assertEquals("100973270", article.journal().nlmCatalogId());
        Assertions.assertEquals(List.of(new Issn("1234-5678", IssnType.PRINT), new Issn("8765-4321", IssnType.ELECTRONIC)),
            article.journal().issns());
        Assertions.assertEquals("12", article.journalIssue().volume());
        Assertions.assertEquals("3", article.journalIssue().issue());
        Assertions.assertEquals(PartialDate.ofYearMonth(2020, 3), article.datePublished());

        Assertions.assertEquals(List.of(new AbstractText("First part.", "BACKGROUND", "BACKGROUND"),
            new AbstractText("Second part.", null, null)), article.abstractTexts());
        Assertions.assertEquals("First part. Second part.", article.fullAbstract());

        Assertions.assertEquals(3, article.authors().size());
        Author first = (Author) article.authors().get(0);
        Assertions.assertEquals("Jane Doe", first.name());
        Assertions.assertEquals("0000-0002-1825-0097", first.orcid());
        Assertions.assertEquals(List.of("University of Testing, Göttingen, Germany."), first.affiliations());
        Author second = (Author) article.authors().get(1);
        Assertions.assertEquals("J Smith", second.name());
        Assertions.assertFalse(second.valid());
        Assertions.assertEquals(new Collective("The Test Consortium", null), article.authors().get(2));

        Assertions.assertEquals(1, article.grants().size());
        Assertions.assertEquals("NIGMS NIH HHS", article.grants().get(0).agency());

        Assertions.assertEquals(List.of("999"), article.citesPubmedIds());
        Assertions.assertEquals(List.of(new Reference("doi", "10.1000/test.1"), new Reference("pmc", "PMC123456")),
            article.xrefs());
        Assertions.assertEquals(List.of(HistoryStatus.RECEIVED, HistoryStatus.ACCEPTED, HistoryStatus.PUBMED),
            article.history().stream().map(h -> h.status()).toList());
        Assertions.assertFalse(article.isRetracted());
    }

    @Test
    void readGzipped() throws IOException, JDOMException {
        Path file = MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0002.xml.gz"), 3, 1, 2);
        Assertions.assertEquals(List.of(3, 1, 2), reader.read(file).stream().map(Article::pubmed).toList());
    }

    @Test
    void malformedFile() throws IOException {
        Path file = tempDir.resolve("broken.xml");
        Files.writeString(file, "<PubmedArticleSet><PubmedArticle>", StandardCharsets.UTF_8);
        Assertions.assertThrows(JDOMException.class, () -> reader.read(file));
    }
}
