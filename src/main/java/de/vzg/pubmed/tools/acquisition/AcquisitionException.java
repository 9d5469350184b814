package de.vzg.pubmed.tools.acquisition;

/**
 * Listing or downloading a file set failed. Not retried.
 */
public class AcquisitionException extends RuntimeException {

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
