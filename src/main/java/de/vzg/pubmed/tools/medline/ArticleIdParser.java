package de.vzg.pubmed.tools.medline;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.jdom2.Element;
import org.jdom2.filter.Filters;
import org.jdom2.xpath.XPathExpression;
import org.jdom2.xpath.XPathFactory;

import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Reference;

/**
 * Reads {@code ArticleIdList} entries: cross references of the article itself and the PMIDs of the
 * articles it cites.
 */
public final class ArticleIdParser {

    // the list repeats the article's own PMID
    private static final Set<String> SKIP_PREFIXES = Set.of(Article.PUBMED_PREFIX);

    private static final XPathFactory XPATH_FACTORY = XPathFactory.instance();
    private static final XPathExpression<Element> OWN_ARTICLE_IDS_XPATH = XPATH_FACTORY.compile(
        "ArticleIdList/ArticleId", Filters.element());
    private static final XPathExpression<Element> CITATION_ARTICLE_IDS_XPATH = XPATH_FACTORY.compile(
        ".//ArticleIdList/ArticleId", Filters.element());

    private ArticleIdParser() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * @param pubmedData the {@code PubmedData} element
     * @return the article's identifiers in other schemes, in source order
     */
    public static List<Reference> xrefs(Element pubmedData) {
        List<Reference> xrefs = new ArrayList<>();
        for (Element articleId : OWN_ARTICLE_IDS_XPATH.evaluate(pubmedData)) {
            String prefix = idType(articleId);
            String identifier = articleId.getTextTrim();
            if (prefix == null || identifier.isEmpty() || SKIP_PREFIXES.contains(prefix)) {
                continue;
            }
            xrefs.add(new Reference(prefix, identifier));
        }
        return xrefs;
    }

    /**
     * @param referenceElement a {@code ReferenceList/Reference} element
     * @return the PMID of the cited article, or null if the citation carries none
     */
    public static String citedPubmedId(Element referenceElement) {
        for (Element articleId : CITATION_ARTICLE_IDS_XPATH.evaluate(referenceElement)) {
            if (Article.PUBMED_PREFIX.equals(idType(articleId))) {
                String pmid = articleId.getTextTrim();
                return pmid.isEmpty() ? null : pmid;
            }
        }
        return null;
    }

    private static String idType(Element articleId) {
        String idType = articleId.getAttributeValue("IdType");
        return idType == null || idType.isBlank() ? null : idType.trim().toLowerCase(Locale.ROOT);
    }
}
