package de.vzg.pubmed.tools.processing;

/**
 * How the files of a run are scheduled. No mode changes what is extracted from a single record.
 */
public enum ProcessingMode {

    /**
     * One file after another on the calling thread.
     */
    SEQUENTIAL,

    /**
     * A bounded worker pool processes a sliding window of files ahead of the consumer. Articles come out
     * in input file order.
     */
    THREADED,

    /**
     * A bounded worker pool hands out each file's articles as soon as the file is done. Higher throughput,
     * but files come out in completion order.
     */
    PARALLEL
}
