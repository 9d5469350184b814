package de.vzg.pubmed.tools.processing;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import de.vzg.pubmed.tools.MedlineFixtures;
import de.vzg.pubmed.tools.model.Article;

class ArticleDeduplicatorTest {

    @Test
    void firstOccurrenceWins() {
        Article latest = Article.builder(2, "Latest").journal(MedlineFixtures.article(2).journal()).build();
        List<Article> kept = ArticleDeduplicator.latestWins(Stream.of(
            MedlineFixtures.article(1), latest, MedlineFixtures.article(2), MedlineFixtures.article(1))).toList();
        Assertions.assertEquals(List.of(1, 2), kept.stream().map(Article::pubmed).toList());
        Assertions.assertEquals("Latest", kept.get(1).title());
    }

    @Test
    void countsDuplicates() {
        ArticleDeduplicator deduplicator = new ArticleDeduplicator();
        long kept = Stream.of(5, 6, 5, 5, 7).map(MedlineFixtures::article).filter(deduplicator).count();
        Assertions.assertEquals(3, kept);
        Assertions.assertEquals(2, deduplicator.getDuplicateCount());
    }
}
