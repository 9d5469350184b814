package de.vzg.pubmed.tools.medline;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.pubmed.tools.grounding.Grounder;
import de.vzg.pubmed.tools.model.Grant;
import de.vzg.pubmed.tools.model.Reference;

/**
 * Parses {@code GrantList/Grant} elements.
 */
public final class GrantParser {

    private static final Logger log = LoggerFactory.getLogger(GrantParser.class);

    private GrantParser() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * @param grantElement the {@code Grant} element
     * @param organizationGrounder grounds the agency text, may be null
     * @return the grant, or null if the agency or the country is missing
     */
    public static Grant parse(Element grantElement, Grounder organizationGrounder) {
        String agency = MedlineUtils.childTextOrNull(grantElement, "Agency");
        String country = MedlineUtils.childTextOrNull(grantElement, "Country");
        if (agency == null || country == null) {
            log.debug("Grant without agency or country: {}", MedlineUtils.toCompactXml(grantElement));
            return null;
        }
        Reference agencyReference = organizationGrounder == null
            ? null
            : organizationGrounder.resolve(agency).orElse(null);
        return new Grant(
            MedlineUtils.childTextOrNull(grantElement, "GrantID"),
            MedlineUtils.childTextOrNull(grantElement, "Acronym"),
            agency,
            agencyReference,
            country);
    }
}
