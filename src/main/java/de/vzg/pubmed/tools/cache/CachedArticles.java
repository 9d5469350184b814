package de.vzg.pubmed.tools.cache;

import java.util.List;

import de.vzg.pubmed.tools.model.Article;

/**
 * Content of a cache artifact.
 *
 * @param version the artifact format version
 * @param fingerprint the fingerprint of the source file when the artifact was written, null if none
 * @param articles the articles parsed from the source file, in file order
 */
public record CachedArticles(int version, String fingerprint, List<Article> articles) {

    public static final int CURRENT_VERSION = 1;

    public CachedArticles {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }
}
