package de.vzg.pubmed.tools.medline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jdom2.Element;
import org.jdom2.filter.Filters;
import org.jdom2.xpath.XPathExpression;
import org.jdom2.xpath.XPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.pubmed.tools.grounding.GroundingServices;
import de.vzg.pubmed.tools.model.AbstractText;
import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Contributor;
import de.vzg.pubmed.tools.model.Grant;
import de.vzg.pubmed.tools.model.Heading;
import de.vzg.pubmed.tools.model.History;
import de.vzg.pubmed.tools.model.Issn;
import de.vzg.pubmed.tools.model.IssnType;
import de.vzg.pubmed.tools.model.Journal;
import de.vzg.pubmed.tools.model.JournalIssue;

/**
 * Converts one {@code PubmedArticle} element into an {@link Article}. Instances are stateless apart from
 * the shared, read-only grounders and may be used from several threads.
 */
public class ArticleExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArticleExtractor.class);

    private static final XPathFactory XPATH_FACTORY = XPathFactory.instance();
    private static final XPathExpression<Element> PUBLICATION_TYPES_XPATH = XPATH_FACTORY.compile(
        ".//PublicationTypeList/PublicationType", Filters.element());
    private static final XPathExpression<Element> MESH_HEADINGS_XPATH = XPATH_FACTORY.compile(
        ".//MeshHeadingList/MeshHeading", Filters.element());
    private static final XPathExpression<Element> ISSNS_XPATH = XPATH_FACTORY.compile(
        ".//Journal/ISSN", Filters.element());
    private static final XPathExpression<Element> ABSTRACT_TEXTS_XPATH = XPATH_FACTORY.compile(
        ".//Abstract/AbstractText", Filters.element());
    private static final XPathExpression<Element> AUTHORS_XPATH = XPATH_FACTORY.compile(
        ".//AuthorList/Author", Filters.element());
    private static final XPathExpression<Element> GRANTS_XPATH = XPATH_FACTORY.compile(
        ".//GrantList/Grant", Filters.element());
    private static final XPathExpression<Element> REFERENCES_XPATH = XPATH_FACTORY.compile(
        ".//ReferenceList/Reference", Filters.element());
    private static final XPathExpression<Element> HISTORY_XPATH = XPATH_FACTORY.compile(
        "History/PubMedPubDate", Filters.element());

    private final GroundingServices grounding;

    public ArticleExtractor() {
        this(GroundingServices.none());
    }

    public ArticleExtractor(GroundingServices grounding) {
        this.grounding = Objects.requireNonNull(grounding, "grounding");
    }

    /**
     * Extracts an article.
     *
     * @param element the {@code PubmedArticle} element
     * @return the article, or empty if the record has no title or no journal information
     * @throws MedlineStructureException if {@code MedlineCitation}, {@code PMID}, {@code Article},
     *     {@code ArticleTitle} or {@code PubmedData} is missing, or the PMID is empty or not a number
     */
    public Optional<Article> extract(Element element) {
        Element medlineCitation = element.getChild(MedlineUtils.MEDLINE_CITATION);
        if (medlineCitation == null) {
            throw new MedlineStructureException("article is missing MedlineCitation tag");
        }
        Element pmidTag = medlineCitation.getChild(MedlineUtils.PMID);
        if (pmidTag == null) {
            throw new MedlineStructureException("article is missing PMID tag");
        }
        String pmidText = pmidTag.getTextTrim();
        if (pmidText.isEmpty()) {
            throw new MedlineStructureException("article has an empty PMID tag");
        }
        int pubmed;
        try {
            pubmed = Integer.parseInt(pmidText);
        } catch (NumberFormatException e) {
            throw new MedlineStructureException(null, "article has a non-numeric PMID: '" + pmidText + "'", e);
        }
        if (pubmed <= 0) {
            throw new MedlineStructureException(null, "article has a non-positive PMID: " + pubmed);
        }

        Element articleTag = medlineCitation.getChild("Article");
        if (articleTag == null) {
            throw new MedlineStructureException(pubmed, "is missing an Article tag");
        }
        Element titleTag = articleTag.getChild("ArticleTitle");
        if (titleTag == null) {
            throw new MedlineStructureException(pubmed, "is missing an ArticleTitle tag");
        }
        String title = MedlineUtils.valueOrNull(titleTag);
        if (title == null) {
            log.debug("[pubmed:{}] has an empty ArticleTitle tag: {}", pubmed, MedlineUtils.toCompactXml(element));
            return Optional.empty();
        }

        Element pubmedData = element.getChild("PubmedData");
        if (pubmedData == null) {
            throw new MedlineStructureException(pubmed, "is missing a PubmedData tag");
        }

        Journal journal = extractJournal(pubmed, medlineCitation);
        if (journal == null) {
            return Optional.empty();
        }

        Article article = Article.builder(pubmed, title)
            .dateCompleted(MedlineDates.parse(medlineCitation.getChild("DateCompleted")))
            .dateRevised(MedlineDates.parse(medlineCitation.getChild("DateRevised")))
            .typeMeshIds(extractTypes(medlineCitation))
            .headings(extractHeadings(pubmed, medlineCitation))
            .journal(journal)
            .journalIssue(extractJournalIssue(articleTag))
            .abstractTexts(extractAbstract(medlineCitation))
            .authors(extractAuthors(pubmed, medlineCitation))
            .grants(extractGrants(medlineCitation))
            .citesPubmedIds(extractCitations(element))
            .xrefs(ArticleIdParser.xrefs(pubmedData))
            .history(extractHistory(pubmedData))
            .build();
        return Optional.of(article);
    }

    private Journal extractJournal(int pubmed, Element medlineCitation) {
        Element medlineJournal = medlineCitation.getChild("MedlineJournalInfo");
        if (medlineJournal == null) {
            log.debug("[pubmed:{}] missing MedlineJournalInfo section", pubmed);
            return null;
        }
        String nlmCatalogId = MedlineUtils.childTextOrNull(medlineJournal, "NlmUniqueID");
        if (nlmCatalogId == null) {
            log.debug("[pubmed:{}] missing NlmUniqueID in MedlineJournalInfo", pubmed);
            return null;
        }

        List<Issn> issns = new ArrayList<>();
        for (Element issnTag : ISSNS_XPATH.evaluate(medlineCitation)) {
            String value = issnTag.getTextTrim();
            if (value.isEmpty()) {
                continue;
            }
            try {
                issns.add(new Issn(value, IssnType.fromLabel(issnTag.getAttributeValue("IssnType"))));
            } catch (IllegalArgumentException e) {
                log.debug("[pubmed:{}] skipping ISSN {}: {}", pubmed, value, e.getMessage());
            }
        }
        return new Journal(MedlineUtils.childTextOrNull(medlineJournal, "ISSNLinking"), nlmCatalogId, issns);
    }

    private List<String> extractTypes(Element medlineCitation) {
        return PUBLICATION_TYPES_XPATH.evaluate(medlineCitation).stream()
            .map(type -> type.getAttributeValue("UI"))
            .filter(ui -> ui != null && !ui.isBlank())
            .map(String::trim)
            .sorted()
            .toList();
    }

    private List<Heading> extractHeadings(int pubmed, Element medlineCitation) {
        List<Heading> headings = new ArrayList<>();
        for (Element headingTag : MESH_HEADINGS_XPATH.evaluate(medlineCitation)) {
            Heading heading;
            try {
                heading = HeadingParser.parse(headingTag, grounding.subjectHeading());
            } catch (MedlineStructureException e) {
                throw withPubmed(pubmed, e);
            }
            if (heading != null) {
                headings.add(heading);
            }
        }
        return headings;
    }

    private JournalIssue extractJournalIssue(Element articleTag) {
        Element journalTag = articleTag.getChild("Journal");
        Element issueTag = journalTag == null ? null : journalTag.getChild("JournalIssue");
        if (issueTag == null) {
            return JournalIssue.EMPTY;
        }
        return new JournalIssue(
            MedlineUtils.childTextOrNull(issueTag, "Volume"),
            MedlineUtils.childTextOrNull(issueTag, "Issue"),
            MedlineDates.parse(issueTag.getChild("PubDate")));
    }

    private List<AbstractText> extractAbstract(Element medlineCitation) {
        List<AbstractText> segments = new ArrayList<>();
        for (Element textTag : ABSTRACT_TEXTS_XPATH.evaluate(medlineCitation)) {
            String text = MedlineUtils.valueOrNull(textTag);
            if (text == null) {
                continue;
            }
            segments.add(new AbstractText(text, textTag.getAttributeValue("Label"),
                textTag.getAttributeValue("NlmCategory")));
        }
        return segments;
    }

    private List<Contributor> extractAuthors(int pubmed, Element medlineCitation) {
        List<Contributor> authors = new ArrayList<>();
        for (Element authorTag : AUTHORS_XPATH.evaluate(medlineCitation)) {
            Contributor contributor;
            try {
                contributor = AuthorParser.parse(pubmed, authorTag, grounding);
            } catch (MedlineStructureException e) {
                throw withPubmed(pubmed, e);
            }
            if (contributor != null) {
                authors.add(contributor);
            }
        }
        return authors;
    }

    private List<Grant> extractGrants(Element medlineCitation) {
        List<Grant> grants = new ArrayList<>();
        for (Element grantTag : GRANTS_XPATH.evaluate(medlineCitation)) {
            Grant grant = GrantParser.parse(grantTag, grounding.organization());
            if (grant != null) {
                grants.add(grant);
            }
        }
        return grants;
    }

    private List<String> extractCitations(Element pubmedArticle) {
        List<String> cited = new ArrayList<>();
        for (Element referenceTag : REFERENCES_XPATH.evaluate(pubmedArticle)) {
            String pmid = ArticleIdParser.citedPubmedId(referenceTag);
            if (pmid != null) {
                cited.add(pmid);
            }
        }
        return cited;
    }

    private List<History> extractHistory(Element pubmedData) {
        List<History> history = new ArrayList<>();
        for (Element pubDate : HISTORY_XPATH.evaluate(pubmedData)) {
            History entry = HistoryParser.parse(pubDate);
            if (entry != null) {
                history.add(entry);
            }
        }
        return history;
    }

    private static MedlineStructureException withPubmed(int pubmed, MedlineStructureException e) {
        return e.getPubmed() == null ? new MedlineStructureException(pubmed, e.getMessage(), e) : e;
    }
}
