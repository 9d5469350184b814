package de.vzg.pubmed.tools.model;

import java.util.Objects;

/**
 * A grant that funded the work.
 *
 * @param id the grant number
 * @param acronym the institute acronym, e.g. {@code GM}
 * @param agency the funding body as free text
 * @param agencyReference the funding body grounded to an organization identifier
 * @param country the country of the funding body as free text
 */
public record Grant(String id, String acronym, String agency, Reference agencyReference, String country) {

    public Grant {
        Objects.requireNonNull(agency, "agency");
        Objects.requireNonNull(country, "country");
    }
}
