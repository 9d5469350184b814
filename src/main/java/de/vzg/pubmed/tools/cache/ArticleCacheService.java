package de.vzg.pubmed.tools.cache;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

import org.jdom2.JDOMException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.vzg.pubmed.tools.medline.MedlineFileReader;
import de.vzg.pubmed.tools.model.Article;

/**
 * Parses PubMed XML files and keeps the result as a gzipped JSON artifact next to each file, so that a
 * file is only parsed again when it changed or reprocessing is forced.
 *
 * <p>Distinct files may be processed concurrently. The same uncached file must not be processed by two
 * threads at once.</p>
 */
@Service
public class ArticleCacheService {

    private static final Logger log = LoggerFactory.getLogger(ArticleCacheService.class);

    static final String CACHE_SUFFIX = ".json.gz";

    private final MedlineFileReader fileReader;
    private final CacheFingerprint fingerprint;
    private final ObjectMapper objectMapper;

    @Autowired
    public ArticleCacheService(MedlineFileReader fileReader, CacheFingerprint fingerprint) {
        this(fileReader, fingerprint, ArticleJson.createObjectMapper());
    }

    public ArticleCacheService(MedlineFileReader fileReader, CacheFingerprint fingerprint, ObjectMapper objectMapper) {
        this.fileReader = Objects.requireNonNull(fileReader, "fileReader");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Returns the articles of a source file, from the cache artifact if it is valid, otherwise by parsing
     * the file and writing a new artifact.
     *
     * @param source a PubMed XML file
     * @param forceProcess parse the file even if a valid artifact exists
     * @return the articles in file order; empty if the file is not well-formed XML or not a readable gzip stream
     * @throws IOException if the source file cannot be read
     */
    public List<Article> process(Path source, boolean forceProcess) throws IOException {
        Path cachePath = getCachePath(source);
        String currentFingerprint = fingerprint.compute(source);

        if (!forceProcess && Files.isRegularFile(cachePath)) {
            List<Article> cached = readCache(cachePath, currentFingerprint);
            if (cached != null) {
                log.debug("Loaded {} articles for {} from cache {}", cached.size(), source.getFileName(), cachePath);
                return cached;
            }
        }

        List<Article> articles;
        try {
            articles = fileReader.read(source);
        } catch (JDOMException e) {
            log.warn("failed to parse {}: {}", source, e.getMessage());
            return List.of();
        } catch (ZipException | EOFException e) {
            // not gzip, or cut off mid-stream
            log.warn("failed to decompress {}: {}", source, e.getMessage());
            return List.of();
        }

        try {
            writeCache(cachePath, new CachedArticles(CachedArticles.CURRENT_VERSION, currentFingerprint, articles));
            log.debug("Cached {} articles for {} in {}", articles.size(), source.getFileName(), cachePath);
        } catch (IOException e) {
            log.error("Could not write cache {}: {}", cachePath, e.getMessage(), e);
        }
        return articles;
    }

    /**
     * @return the artifact location, the source name with {@code .xml}/{@code .xml.gz} replaced by {@code .json.gz}
     */
    public static Path getCachePath(Path source) {
        String name = source.getFileName().toString();
        String stem;
        if (name.endsWith(".xml.gz")) {
            stem = name.substring(0, name.length() - ".xml.gz".length());
        } else if (name.endsWith(".xml")) {
            stem = name.substring(0, name.length() - ".xml".length());
        } else {
            stem = name;
        }
        return source.resolveSibling(stem + CACHE_SUFFIX);
    }

    /**
     * @return the cached articles, or null if the artifact is stale, from another format version or unreadable
     */
    private List<Article> readCache(Path cachePath, String currentFingerprint) {
        CachedArticles cached;
        try (InputStream is = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(cachePath)))) {
            cached = objectMapper.readValue(is, CachedArticles.class);
        } catch (JacksonException | IllegalArgumentException e) {
            log.warn("Cache {} is corrupt, reprocessing: {}", cachePath, e.getMessage());
            return null;
        } catch (IOException e) {
            // truncated gzip streams end up here
            log.warn("Cache {} is unreadable, reprocessing: {}", cachePath, e.getMessage());
            return null;
        }
        if (cached == null) {
            log.warn("Cache {} is empty, reprocessing", cachePath);
            return null;
        }
        if (cached.version() != CachedArticles.CURRENT_VERSION) {
            log.info("Cache {} has format version {}, reprocessing", cachePath, cached.version());
            return null;
        }
        if (!Objects.equals(cached.fingerprint(), currentFingerprint)) {
            log.info("Cache {} is stale ({} != {}), reprocessing", cachePath, cached.fingerprint(), currentFingerprint);
            return null;
        }
        return cached.articles();
    }

    /**
     * Writes to a temporary file in the target directory and moves it into place, so an interrupted run
     * never leaves a truncated artifact under the final name.
     */
    private void writeCache(Path cachePath, CachedArticles content) throws IOException {
        Path tempFile = Files.createTempFile(cachePath.toAbsolutePath().getParent(), cachePath.getFileName().toString(), ".tmp");
        try {
            try (OutputStream os = new GZIPOutputStream(new BufferedOutputStream(Files.newOutputStream(tempFile)))) {
                objectMapper.writeValue(os, content);
            }
            try {
                Files.move(tempFile, cachePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, cachePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }
}
