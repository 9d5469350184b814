package de.vzg.pubmed.tools.medline;

/**
 * Thrown when a {@code PubmedArticle} element lacks a part that every record is required to have. Fatal
 * for the record, never for the file it came from.
 */
public class MedlineStructureException extends RuntimeException {

    private final Integer pubmed;

    public MedlineStructureException(String message) {
        this(null, message);
    }

    public MedlineStructureException(Integer pubmed, String message) {
        super(pubmed == null ? message : "[pubmed:" + pubmed + "] " + message);
        this.pubmed = pubmed;
    }

    public MedlineStructureException(Integer pubmed, String message, Throwable cause) {
        super(pubmed == null ? message : "[pubmed:" + pubmed + "] " + message, cause);
        this.pubmed = pubmed;
    }

    /**
     * @return the PMID of the offending record, or {@code null} if it could not be read
     */
    public Integer getPubmed() {
        return pubmed;
    }
}
