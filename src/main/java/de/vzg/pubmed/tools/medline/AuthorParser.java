package de.vzg.pubmed.tools.medline;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.pubmed.tools.grounding.GroundingServices;
import de.vzg.pubmed.tools.model.Author;
import de.vzg.pubmed.tools.model.Collective;
import de.vzg.pubmed.tools.model.Contributor;
import de.vzg.pubmed.tools.model.Reference;

/**
 * Parses {@code AuthorList/Author} elements into individual authors or collectives.
 */
public final class AuthorParser {

    private static final Logger log = LoggerFactory.getLogger(AuthorParser.class);

    private static final String ORCID_SOURCE = "ORCID";

    private static final Set<String> NAME_TAGS = Set.of("LastName", "ForeName", "Initials", "AffiliationInfo");

    private AuthorParser() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * @param pubmed the PMID of the article, for logging
     * @param authorElement the {@code Author} element
     * @param grounding grounders for collectives and author names
     * @return the contributor, or null if it has neither a usable name nor an ORCID
     * @throws MedlineStructureException if {@code ValidYN} is not Y/N
     */
    public static Contributor parse(int pubmed, Element authorElement, GroundingServices grounding) {
        String collectiveName = MedlineUtils.valueOrNull(authorElement.getChild("CollectiveName"));
        if (collectiveName != null) {
            Reference reference = grounding.organizationGrounder()
                .flatMap(grounder -> grounder.resolve(collectiveName))
                .orElse(null);
            log.debug("[pubmed:{}] collective author: {} ({})", pubmed, collectiveName, reference);
            return new Collective(collectiveName, reference);
        }

        boolean valid = MedlineUtils.parseYesNo(authorElement.getAttributeValue("ValidYN"), true, "ValidYN");
        List<String> affiliations = new ArrayList<>();
        for (Element info : authorElement.getChildren("AffiliationInfo")) {
            String affiliation = MedlineUtils.childTextOrNull(info, "Affiliation");
            if (affiliation != null) {
                affiliations.add(affiliation);
            }
        }
        String orcid = extractOrcid(pubmed, authorElement);

        String lastName = MedlineUtils.childTextOrNull(authorElement, "LastName");
        String foreName = MedlineUtils.childTextOrNull(authorElement, "ForeName");
        String initials = MedlineUtils.childTextOrNull(authorElement, "Initials");

        String name = null;
        if (lastName != null && foreName != null) {
            name = foreName + " " + lastName;
        } else if (lastName != null && initials != null) {
            name = initials + " " + lastName;
        }

        if (orcid == null && name != null) {
            orcid = groundOrcid(pubmed, name, grounding);
        }

        if (name == null && orcid == null) {
            if (lastName == null) {
                log.warn("[pubmed:{}] author without last name. Other tags to check: {}", pubmed,
                    remainingTags(authorElement));
            } else {
                log.debug("[pubmed:{}] no forename given for author {}. Other tags to check: {}", pubmed, lastName,
                    remainingTags(authorElement));
            }
            return null;
        }
        return new Author(name, valid, affiliations, orcid);
    }

    private static String extractOrcid(int pubmed, Element authorElement) {
        String orcid = null;
        for (Element identifier : authorElement.getChildren("Identifier")) {
            String source = identifier.getAttributeValue("Source");
            if (!ORCID_SOURCE.equals(source)) {
                log.warn("[pubmed:{}] unhandled identifier source: {}", pubmed, source);
                continue;
            }
            String text = identifier.getTextTrim();
            if (text.isEmpty()) {
                continue;
            }
            String cleaned = OrcidUtils.clean(text);
            if (cleaned == null) {
                log.warn("[pubmed:{}] unhandled ORCID: {}", pubmed, text);
            } else {
                orcid = cleaned;
            }
        }
        return orcid;
    }

    private static String groundOrcid(int pubmed, String name, GroundingServices grounding) {
        return grounding.contributorGrounder()
            .flatMap(grounder -> grounder.resolve(name))
            .filter(reference -> {
                boolean isOrcid = Author.ORCID_PREFIX.equals(reference.prefix());
                if (!isOrcid) {
                    log.debug("[pubmed:{}] ignoring non-ORCID grounding {} for {}", pubmed, reference, name);
                }
                return isOrcid;
            })
            .map(Reference::identifier)
            .orElse(null);
    }

    private static Set<String> remainingTags(Element authorElement) {
        return authorElement.getChildren().stream()
            .map(Element::getName)
            .filter(tag -> !NAME_TAGS.contains(tag))
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
