package de.vzg.pubmed.tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import de.vzg.pubmed.tools.acquisition.AcquisitionException;
import de.vzg.pubmed.tools.acquisition.ArticleFileService;
import de.vzg.pubmed.tools.acquisition.FileSet;
import de.vzg.pubmed.tools.acquisition.FileSource;
import de.vzg.pubmed.tools.cache.ArticleCacheService;
import de.vzg.pubmed.tools.edges.EdgeExportService;
import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Triple;
import de.vzg.pubmed.tools.processing.ArticleDeduplicator;
import de.vzg.pubmed.tools.processing.ArticleProcessingService;
import de.vzg.pubmed.tools.processing.ProcessingMode;

@ShellComponent
public class ToolsShell {

    private static final Logger log = LoggerFactory.getLogger(ToolsShell.class);

    private final ArticleProcessingService processingService;
    private final ArticleCacheService cacheService;
    private final ArticleFileService fileService;
    private final EdgeExportService edgeExportService;

    @Autowired
    public ToolsShell(ArticleProcessingService processingService,
                      ArticleCacheService cacheService,
                      ArticleFileService fileService,
                      EdgeExportService edgeExportService) {
        this.processingService = processingService;
        this.cacheService = cacheService;
        this.fileService = fileService;
        this.edgeExportService = edgeExportService;
    }

    @ShellMethod(key = "process-articles", value = "Processes the update files and the baseline into cached articles.")
    public void processArticles(
            @ShellOption(value = {"--source"}, defaultValue = "local", help = "Where files come from: remote or local.") String source,
            @ShellOption(value = {"--mode"}, defaultValue = "sequential", help = "sequential, threaded or parallel.") String mode,
            @ShellOption(value = {"--force-process"}, defaultValue = "false", help = "Ignore existing cache artifacts.") boolean forceProcess,
            @ShellOption(value = {"--force-listing"}, defaultValue = "false", help = "Refresh the remote file listings.") boolean forceListing,
            @ShellOption(value = {"--latest-only"}, defaultValue = "false", help = "Keep only the latest version of every PMID.") boolean latestOnly,
            @ShellOption(value = {"--limit"}, defaultValue = "0", help = "Stop after this many articles (0 for all).") long limit) {
        try (Stream<Article> articles = articles(source, mode, forceProcess, forceListing, latestOnly, limit)) {
            long count = 0;
            long retracted = 0;
            for (Article article : (Iterable<Article>) articles::iterator) {
                count++;
                if (article.isRetracted()) {
                    retracted++;
                }
            }
            System.out.println("Processed " + count + " articles (" + retracted + " retracted).");
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid argument provided: " + e.getMessage());
        } catch (AcquisitionException e) {
            System.err.println("Error while fetching PubMed files: " + e.getMessage());
        } catch (UncheckedIOException e) {
            System.err.println("Error during file I/O: " + e.getCause().getMessage());
        } catch (Exception e) {
            System.err.println("An unexpected error occurred during processing: " + e.getMessage());
            log.error("Processing failed", e);
        }
    }

    @ShellMethod(key = "process-file", value = "Processes a single PubMed XML file and prints a summary.")
    public void processFile(
            @ShellOption(value = {"-i", "--input"}, help = "Path to the PubMed XML file (.xml or .xml.gz).") String input,
            @ShellOption(value = {"--force-process"}, defaultValue = "false", help = "Ignore an existing cache artifact.") boolean forceProcess) {
        Path inputPath = Paths.get(input);
        try {
            List<Article> articles = cacheService.process(inputPath, forceProcess);
            System.out.println("Read " + articles.size() + " articles from " + inputPath
                + ", cached at " + ArticleCacheService.getCachePath(inputPath));
        } catch (IOException e) {
            System.err.println("Error during file I/O: " + e.getMessage());
        } catch (Exception e) {
            System.err.println("An unexpected error occurred while processing " + inputPath + ": " + e.getMessage());
            log.error("Processing of {} failed", inputPath, e);
        }
    }

    @ShellMethod(key = "export-edges", value = "Writes the article graph statements as a gzipped TSV file.")
    public void exportEdges(
            @ShellOption(value = {"-o", "--output"}, help = "Path to the output file, e.g. edges.tsv.gz.") String output,
            @ShellOption(value = {"--source"}, defaultValue = "local", help = "Where files come from: remote or local.") String source,
            @ShellOption(value = {"--mode"}, defaultValue = "sequential", help = "sequential, threaded or parallel.") String mode,
            @ShellOption(value = {"--force-process"}, defaultValue = "false", help = "Ignore existing cache artifacts.") boolean forceProcess,
            @ShellOption(value = {"--force-listing"}, defaultValue = "false", help = "Refresh the remote file listings.") boolean forceListing,
            @ShellOption(value = {"--latest-only"}, defaultValue = "false", help = "Keep only the latest version of every PMID.") boolean latestOnly,
            @ShellOption(value = {"--force"}, defaultValue = "false", help = "Rewrite the output file if it exists.") boolean force) {
        Path outputPath = Paths.get(output);
        try {
            List<Triple> edges = edgeExportService.getEdges(outputPath,
                () -> articles(source, mode, forceProcess, forceListing, latestOnly, 0), force);
            System.out.println(edges.size() + " edges available in " + outputPath);
        } catch (IOException e) {
            System.err.println("Error during file I/O: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid argument provided: " + e.getMessage());
        } catch (Exception e) {
            System.err.println("An unexpected error occurred during edge export: " + e.getMessage());
            log.error("Edge export failed", e);
        }
    }

    @ShellMethod(key = "export-xrefs", value = "Writes PMID to external identifier mappings as a TSV file.")
    public void exportXrefs(
            @ShellOption(value = {"-o", "--output"}, help = "Path to the output file, e.g. xrefs.tsv.gz.") String output,
            @ShellOption(value = {"--source"}, defaultValue = "local", help = "Where files come from: remote or local.") String source,
            @ShellOption(value = {"--mode"}, defaultValue = "sequential", help = "sequential, threaded or parallel.") String mode,
            @ShellOption(value = {"--force-process"}, defaultValue = "false", help = "Ignore existing cache artifacts.") boolean forceProcess,
            @ShellOption(value = {"--force-listing"}, defaultValue = "false", help = "Refresh the remote file listings.") boolean forceListing) {
        Path outputPath = Paths.get(output);
        try (Stream<Article> articles = articles(source, mode, forceProcess, forceListing, true, 0)) {
            long count = edgeExportService.writeXrefMappings(articles, outputPath);
            System.out.println("Wrote " + count + " mappings to " + outputPath);
        } catch (IOException e) {
            System.err.println("Error during file I/O: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid argument provided: " + e.getMessage());
        } catch (Exception e) {
            System.err.println("An unexpected error occurred during xref export: " + e.getMessage());
            log.error("Xref export failed", e);
        }
    }

    @ShellMethod(key = "list-files", value = "Lists the local paths of a PubMed file set, downloading missing files.")
    public void listFiles(
            @ShellOption(value = {"--set"}, defaultValue = "baseline", help = "baseline or updates.") String set,
            @ShellOption(value = {"--source"}, defaultValue = "local", help = "Where files come from: remote or local.") String source,
            @ShellOption(value = {"--force-listing"}, defaultValue = "false", help = "Refresh the remote file listing.") boolean forceListing) {
        try {
            List<Path> paths = fileService.listFiles(parse(FileSet.class, set), parse(FileSource.class, source), forceListing);
            paths.forEach(System.out::println);
            System.out.println(paths.size() + " files");
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid argument provided: " + e.getMessage());
        } catch (AcquisitionException e) {
            System.err.println("Error while fetching PubMed files: " + e.getMessage());
        }
    }

    private Stream<Article> articles(String source, String mode, boolean forceProcess, boolean forceListing,
                                     boolean latestOnly, long limit) {
        Stream<Article> articles = processingService.processArticles(parse(FileSource.class, source),
            parse(ProcessingMode.class, mode), forceProcess, forceListing);
        if (latestOnly) {
            articles = ArticleDeduplicator.latestWins(articles);
        }
        if (limit > 0) {
            articles = articles.limit(limit);
        }
        return articles;
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " '" + value + "'", e);
        }
    }
}
