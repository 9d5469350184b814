package de.vzg.pubmed.tools.processing;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import de.vzg.pubmed.tools.acquisition.ArticleFileService;
import de.vzg.pubmed.tools.acquisition.FileSet;
import de.vzg.pubmed.tools.acquisition.FileSource;
import de.vzg.pubmed.tools.cache.ArticleCacheService;
import de.vzg.pubmed.tools.model.Article;

/**
 * Turns lists of PubMed files into one stream of articles, going through the per-file cache.
 *
 * <p>No de-duplication happens here: a PMID present in several files is emitted once per file. Use
 * {@link ArticleDeduplicator} where only the latest version of each record is wanted.</p>
 */
@Service
public class ArticleProcessingService {

    private static final Logger log = LoggerFactory.getLogger(ArticleProcessingService.class);

    private static final int LOG_INTERVAL = 50; // Log progress every 50 files

    private final ArticleCacheService cacheService;
    private final ArticleFileService fileService;
    private final int workers;

    @Autowired
    public ArticleProcessingService(ArticleCacheService cacheService, ArticleFileService fileService,
        @Value("${pubmed.processing.workers:4}") int workers) {
        this.cacheService = cacheService;
        this.fileService = fileService;
        this.workers = Math.max(1, workers);
    }

    /**
     * Processes updates, then the baseline, and concatenates the results.
     */
    public Stream<Article> processArticles(FileSource source, ProcessingMode mode, boolean forceProcess,
        boolean forceListing) {
        return Stream.of(FileSet.UPDATES, FileSet.BASELINE)
            .flatMap(fileSet -> processFileSet(fileSet, source, mode, forceProcess, forceListing));
    }

    public Stream<Article> processFileSet(FileSet fileSet, FileSource source, ProcessingMode mode,
        boolean forceProcess, boolean forceListing) {
        List<Path> paths = fileService.listFiles(fileSet, source, forceListing);
        log.info("Processing {} {} files ({})", paths.size(), fileSet, mode);
        return processFiles(paths, mode, forceProcess, fileSet.name().toLowerCase(Locale.ROOT));
    }

    public Stream<Article> processFiles(List<Path> paths, ProcessingMode mode, boolean forceProcess) {
        return processFiles(paths, mode, forceProcess, "source");
    }

    private Stream<Article> processFiles(List<Path> paths, ProcessingMode mode, boolean forceProcess, String unit) {
        List<Path> unique = distinct(paths);
        Progress progress = new Progress(unit, unique.size());
        return switch (mode) {
            case SEQUENTIAL -> unique.stream()
                .flatMap(path -> progress.done(path, processFile(path, forceProcess)).stream());
            case THREADED -> pooled(unique, true, path -> progress.done(path, processFile(path, forceProcess)));
            case PARALLEL -> pooled(unique, false, path -> progress.done(path, processFile(path, forceProcess)));
        };
    }

    private List<Article> processFile(Path path, boolean forceProcess) {
        try {
            return cacheService.process(path, forceProcess);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not process " + path, e);
        }
    }

    private Stream<Article> pooled(List<Path> paths, boolean ordered,
        Function<Path, List<Article>> task) {
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        FileBatchIterator batches = new FileBatchIterator(paths, executor, workers * 2, ordered, task);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(batches, ordered ? Spliterator.ORDERED : 0), false)
            .onClose(executor::shutdownNow)
            .flatMap(List::stream);
    }

    /**
     * The same file is never scheduled twice in one run; two workers writing one cache artifact would race.
     */
    private static List<Path> distinct(List<Path> paths) {
        LinkedHashSet<Path> seen = new LinkedHashSet<>();
        List<Path> unique = new ArrayList<>(paths.size());
        for (Path path : paths) {
            if (seen.add(path.toAbsolutePath().normalize())) {
                unique.add(path);
            } else {
                log.warn("Skipping duplicate path {}", path);
            }
        }
        return unique;
    }

    private static final class Progress {
        private final String unit;
        private final int total;
        private final AtomicInteger count = new AtomicInteger();

        Progress(String unit, int total) {
            this.unit = unit;
            this.total = total;
        }

        List<Article> done(Path path, List<Article> articles) {
            int done = count.incrementAndGet();
            log.debug("Processed {} ({} articles)", path.getFileName(), articles.size());
            if (done % LOG_INTERVAL == 0 || done == total) {
                log.info("Processed {}/{} {} files", done, total, unit);
            }
            return articles;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_NUMBER = new AtomicInteger();
        private final int poolNumber = POOL_NUMBER.incrementAndGet();
        private final AtomicInteger threadNumber = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "pubmed-" + poolNumber + "-worker-" + threadNumber.incrementAndGet());
            // an abandoned stream must not keep the JVM alive
            thread.setDaemon(true);
            return thread;
        }
    }
}
