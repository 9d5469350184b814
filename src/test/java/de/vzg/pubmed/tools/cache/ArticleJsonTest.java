package de.vzg.pubmed.tools.cache;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.vzg.pubmed.tools.model.AbstractText;
import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Author;
import de.vzg.pubmed.tools.model.Collective;
import de.vzg.pubmed.tools.model.Grant;
import de.vzg.pubmed.tools.model.Heading;
import de.vzg.pubmed.tools.model.History;
import de.vzg.pubmed.tools.model.HistoryStatus;
import de.vzg.pubmed.tools.model.Issn;
import de.vzg.pubmed.tools.model.IssnType;
import de.vzg.pubmed.tools.model.Journal;
import de.vzg.pubmed.tools.model.JournalIssue;
import de.vzg.pubmed.tools.model.PartialDate;
import de.vzg.pubmed.tools.model.Qualifier;
import de.vzg.pubmed.tools.model.Reference;

class ArticleJsonTest {

    private final ObjectMapper objectMapper = ArticleJson.createObjectMapper();

    private static Article fullArticle() {
        return Article.builder(12345, "Test")
            .dateCompleted(PartialDate.of(2020, 3, 15))
            .typeMeshIds(List.of("D016428", "D016441"))
            .headings(List.of(new Heading("D001943", true, List.of(new Qualifier("Q000235", false))),
                new Heading("D006801", false, null)))
            .journal(new Journal("1234-5678", "100973270", List.of(new Issn("1234-5678", IssnType.PRINT))))
            .journalIssue(new JournalIssue("12", null, PartialDate.ofYearMonth(2020, 3)))
            .abstractTexts(List.of(new AbstractText("Text.", "METHODS", null)))
            .authors(List.of(new Author("Jane Doe", true, List.of("Uni A"), "0000-0002-1825-0097"),
                new Author("J Smith", false, null, null),
                new Collective("The Test Consortium", new Reference("ror", "000000001"))))
            .citesPubmedIds(List.of("999"))
            .xrefs(List.of(new Reference("doi", "10.1000/test:1")))
            .history(List.of(new History(HistoryStatus.PMC_RELEASE, PartialDate.ofYear(2021))))
            .grants(List.of(new Grant(null, null, "NIGMS NIH HHS", null, "United States")))
            .build();
    }

    @Test
    void readsBackWhatItWrites() throws JsonProcessingException {
        Article article = fullArticle();
        Article read = objectMapper.readValue(objectMapper.writeValueAsString(article), Article.class);
        Assertions.assertEquals(article, read);
        Assertions.assertTrue(read.isRetracted());
    }

    @Test
    void compactWireForm() throws JsonProcessingException {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(fullArticle()));
        Assertions.assertEquals("2020-03-15", json.get("dateCompleted").asText());
        Assertions.assertFalse(json.has("dateRevised"));
        Assertions.assertEquals("author", json.get("authors").get(0).get("kind").asText());
        Assertions.assertEquals("collective", json.get("authors").get(2).get("kind").asText());
        Assertions.assertEquals("ror:000000001", json.get("authors").get(2).get("reference").asText());
        Assertions.assertFalse(json.get("authors").get(1).has("valid"));
        Assertions.assertFalse(json.get("headings").get(1).has("qualifiers"));
        Assertions.assertEquals("Print", json.get("journal").get("issns").get(0).get("type").asText());
        Assertions.assertEquals("pmc-release", json.get("history").get(0).get("status").asText());
        Assertions.assertEquals("doi:10.1000/test:1", json.get("xrefs").get(0).asText());
        Assertions.assertFalse(json.has("reference"));
        Assertions.assertFalse(json.has("retracted"));
    }

    @Test
    void minimalArticleDefaults() throws JsonProcessingException {
        Article read = objectMapper.readValue(
            "{\"pubmed\":7,\"title\":\"T\",\"journal\":{\"nlmCatalogId\":\"1\"},\"unknown\":true}", Article.class);
        Assertions.assertEquals(List.of(), read.headings());
        Assertions.assertEquals(JournalIssue.EMPTY, read.journalIssue());
        Assertions.assertEquals(List.of(), read.journal().issns());
    }
}
