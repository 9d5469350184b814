package de.vzg.pubmed.tools.processing;

import java.util.BitSet;
import java.util.function.Predicate;
import java.util.stream.Stream;

import de.vzg.pubmed.tools.model.Article;

/**
 * Keeps the first article seen for every PMID and drops later ones.
 *
 * <p>Update files are listed newest first and come before the baseline, so on a stream from
 * {@link ArticleProcessingService#processArticles} the first occurrence is the latest version of a
 * record. Not applied by default: callers opt in.</p>
 */
public class ArticleDeduplicator implements Predicate<Article> {

    private final BitSet seen = new BitSet();
    private long duplicates;

    public static Stream<Article> latestWins(Stream<Article> articles) {
        return articles.filter(new ArticleDeduplicator());
    }

    @Override
    public synchronized boolean test(Article article) {
        if (seen.get(article.pubmed())) {
            duplicates++;
            return false;
        }
        seen.set(article.pubmed());
        return true;
    }

    public synchronized long getDuplicateCount() {
        return duplicates;
    }
}
