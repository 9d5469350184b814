package de.vzg.pubmed.tools.edges;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.vzg.pubmed.tools.model.Article;
import de.vzg.pubmed.tools.model.Reference;
import de.vzg.pubmed.tools.model.Triple;

/**
 * Writes and reads flat statement files: one tab separated {@code subject predicate object} line per
 * statement, each part a CURIE. Files ending in {@code .gz} are compressed.
 */
@Service
public class EdgeExportService {

    private static final Logger log = LoggerFactory.getLogger(EdgeExportService.class);

    private static final int LOG_INTERVAL = 1_000_000;

    /**
     * Returns the edges stored at {@code edgesPath}, or computes and stores them first if the file is
     * missing or {@code force} is set.
     */
    public List<Triple> getEdges(Path edgesPath, Supplier<Stream<Article>> articles, boolean force) throws IOException {
        if (Files.isRegularFile(edgesPath) && !force) {
            return readEdges(edgesPath);
        }
        List<Triple> triples;
        try (Stream<Article> stream = articles.get()) {
            triples = stream.flatMap(article -> EdgeProjector.project(article).stream()).toList();
        }
        writeTriples(triples.iterator(), edgesPath);
        return triples;
    }

    /**
     * @return the number of statements written
     */
    public long writeEdges(Stream<Article> articles, Path edgesPath) throws IOException {
        return writeTriples(articles.flatMap(article -> EdgeProjector.project(article).stream()).iterator(), edgesPath);
    }

    /**
     * Writes one {@code pubmed:<id> xref} pair per line.
     *
     * @return the number of mappings written
     */
    public long writeXrefMappings(Stream<Article> articles, Path mappingsPath) throws IOException {
        Iterator<Reference[]> rows = articles
            .flatMap(article -> article.xrefs().stream().map(xref -> new Reference[] { article.reference(), xref }))
            .iterator();
        return writeAtomically(mappingsPath, writer -> {
            long count = 0;
            while (rows.hasNext()) {
                Reference[] row = rows.next();
                writer.write(row[0].curie() + "\t" + row[1].curie() + "\n");
                count++;
            }
            return count;
        });
    }

    public List<Triple> readEdges(Path edgesPath) throws IOException {
        List<Triple> triples = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(open(edgesPath), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                String[] parts = line.split("\t");
                if (parts.length != 3) {
                    throw new IOException("Line " + lineNumber + " of " + edgesPath + " is not a triple: " + line);
                }
                try {
                    triples.add(new Triple(Reference.fromCurie(parts[0]), Reference.fromCurie(parts[1]),
                        Reference.fromCurie(parts[2])));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Line " + lineNumber + " of " + edgesPath + ": " + e.getMessage(), e);
                }
            }
        }
        log.info("Read {} edges from {}", triples.size(), edgesPath);
        return triples;
    }

    private long writeTriples(Iterator<Triple> triples, Path edgesPath) throws IOException {
        long written = writeAtomically(edgesPath, writer -> {
            long count = 0;
            while (triples.hasNext()) {
                Triple triple = triples.next();
                writer.write(triple.subject().curie() + "\t" + triple.predicate().curie() + "\t"
                    + triple.object().curie() + "\n");
                if (++count % LOG_INTERVAL == 0) {
                    log.info("Wrote {} edges...", count);
                }
            }
            return count;
        });
        log.info("Wrote {} edges to {}", written, edgesPath);
        return written;
    }

    private static InputStream open(Path path) throws IOException {
        InputStream is = Files.newInputStream(path);
        return path.getFileName().toString().endsWith(".gz") ? new GZIPInputStream(is) : is;
    }

    private static long writeAtomically(Path target, LineWriter body) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            long count;
            OutputStream os = Files.newOutputStream(tempFile);
            if (target.getFileName().toString().endsWith(".gz")) {
                os = new GZIPOutputStream(os);
            }
            try (Writer writer = new BufferedWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8))) {
                count = body.write(writer);
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return count;
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    @FunctionalInterface
    private interface LineWriter {
        long write(Writer writer) throws IOException;
    }
}
