package de.vzg.pubmed.tools.medline;

import java.util.Optional;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.pubmed.tools.model.History;
import de.vzg.pubmed.tools.model.HistoryStatus;
import de.vzg.pubmed.tools.model.PartialDate;

/**
 * Parses {@code History/PubMedPubDate} elements.
 */
public final class HistoryParser {

    private static final Logger log = LoggerFactory.getLogger(HistoryParser.class);

    private HistoryParser() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * @param pubDateElement the {@code PubMedPubDate} element
     * @return the history entry, or null if the status is missing or unknown or the date is unusable
     */
    public static History parse(Element pubDateElement) {
        String status = pubDateElement.getAttributeValue("PubStatus");
        if (status == null) {
            log.warn("missing status: {}", MedlineUtils.toCompactXml(pubDateElement));
            return null;
        }
        PartialDate date = MedlineDates.parse(pubDateElement);
        if (date == null) {
            return null;
        }
        Optional<HistoryStatus> historyStatus = HistoryStatus.find(status.trim());
        if (historyStatus.isEmpty()) {
            log.warn("invalid status: {}", status);
            return null;
        }
        return new History(historyStatus.get(), date);
    }
}
