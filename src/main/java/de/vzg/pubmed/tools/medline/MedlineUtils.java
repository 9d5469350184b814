package de.vzg.pubmed.tools.medline;

import org.jdom2.Element;
import org.jdom2.filter.Filters;
import org.jdom2.output.Format;
import org.jdom2.output.XMLOutputter;
import org.jdom2.xpath.XPathExpression;
import org.jdom2.xpath.XPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for reading MEDLINE/PubMed XML elements.
 */
public final class MedlineUtils {

    private static final Logger log = LoggerFactory.getLogger(MedlineUtils.class);

    public static final String PUBMED_ARTICLE = "PubmedArticle";
    public static final String MEDLINE_CITATION = "MedlineCitation";
    public static final String PMID = "PMID";

    private static final XPathExpression<Element> PMID_XPATH = XPathFactory.instance().compile(
        MEDLINE_CITATION + "/" + PMID, Filters.element());

    private MedlineUtils() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Extracts the PMID ({@code MedlineCitation/PMID}) from a {@code PubmedArticle} element.
     *
     * @param articleElement The JDOM element for the {@code <PubmedArticle>}.
     * @return The PMID string, or null if not found or empty.
     */
    public static String extractPmid(Element articleElement) {
        if (articleElement == null) {
            log.warn("Cannot extract PMID from null article element.");
            return null;
        }
        Element pmidElement = PMID_XPATH.evaluateFirst(articleElement);
        if (pmidElement != null) {
            String pmid = pmidElement.getTextTrim();
            if (!pmid.isEmpty()) {
                return pmid;
            }
            log.trace("PMID element found but text is empty.");
        }
        return null;
    }

    /**
     * Parses a {@code Y}/{@code N} attribute token.
     *
     * @param token the attribute value, {@code null} if the attribute is absent
     * @param defaultValue the value an absent attribute stands for
     * @param attribute the attribute name, for the error message
     * @return the flag
     * @throws MedlineStructureException for any token other than {@code Y} or {@code N}
     */
    public static boolean parseYesNo(String token, boolean defaultValue, String attribute) {
        if (token == null) {
            return defaultValue;
        }
        switch (token) {
            case "Y":
                return true;
            case "N":
                return false;
            default:
                throw new MedlineStructureException("Invalid " + attribute + " value: '" + token + "'");
        }
    }

    /**
     * @return the trimmed text of the named child, or null if the child is absent or empty
     */
    public static String childTextOrNull(Element parent, String childName) {
        if (parent == null) {
            return null;
        }
        String text = parent.getChildTextTrim(childName);
        return text == null || text.isEmpty() ? null : text;
    }

    /**
     * @return the trimmed text content of the element including inline markup, or null if empty
     */
    public static String valueOrNull(Element element) {
        if (element == null) {
            return null;
        }
        String value = element.getValue().trim();
        return value.isEmpty() ? null : value;
    }

    public static String toCompactXml(Element element) {
        return new XMLOutputter(Format.getCompactFormat()).outputString(element);
    }
}
