package de.vzg.pubmed.tools.acquisition;

/**
 * The two file sets PubMed publishes: the yearly baseline and the daily update files.
 */
public enum FileSet {
    BASELINE("https://ftp.ncbi.nlm.nih.gov/pubmed/baseline/", "baseline", "baseline.html"),
    UPDATES("https://ftp.ncbi.nlm.nih.gov/pubmed/updatefiles/", "updates", "updates.html");

    private final String baseUrl;
    private final String directoryName;
    private final String indexFileName;

    FileSet(String baseUrl, String directoryName, String indexFileName) {
        this.baseUrl = baseUrl;
        this.directoryName = directoryName;
        this.indexFileName = indexFileName;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return the sub-directory of the data directory the files are stored in
     */
    public String getDirectoryName() {
        return directoryName;
    }

    /**
     * @return the name under which the remote directory listing is kept
     */
    public String getIndexFileName() {
        return indexFileName;
    }
}
