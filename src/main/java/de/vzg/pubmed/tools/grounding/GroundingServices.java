package de.vzg.pubmed.tools.grounding;

import java.util.Optional;

/**
 * The grounders used during extraction, one per grounding domain. Any of them may be absent, in which
 * case the corresponding reference fields stay unset.
 *
 * @param organization grounds funding agencies and collective authors (e.g. to ROR)
 * @param subjectHeading grounds descriptor names to MeSH identifiers
 * @param contributor grounds author names to ORCID identifiers
 */
public record GroundingServices(Grounder organization, Grounder subjectHeading, Grounder contributor) {

    private static final GroundingServices NONE = new GroundingServices(null, null, null);

    public static GroundingServices none() {
        return NONE;
    }

    public Optional<Grounder> organizationGrounder() {
        return Optional.ofNullable(organization);
    }

    public Optional<Grounder> subjectHeadingGrounder() {
        return Optional.ofNullable(subjectHeading);
    }

    public Optional<Grounder> contributorGrounder() {
        return Optional.ofNullable(contributor);
    }
}
