package de.vzg.pubmed.tools.acquisition;

/**
 * Where the files of a {@link FileSet} come from.
 */
public enum FileSource {
    /**
     * List the files on the NCBI server and download those not yet present.
     */
    REMOTE,
    /**
     * Use the files already in the local data directory.
     */
    LOCAL
}
