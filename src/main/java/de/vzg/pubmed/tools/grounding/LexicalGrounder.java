package de.vzg.pubmed.tools.grounding;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.pubmed.tools.model.Reference;

/**
 * An exact-match grounder over a fixed label index. Labels are compared case-insensitively with
 * whitespace collapsed. The index is copied on construction and never modified afterwards.
 */
public final class LexicalGrounder implements Grounder {

    private static final Logger log = LoggerFactory.getLogger(LexicalGrounder.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, Reference> index;

    private LexicalGrounder(Map<String, Reference> index) {
        this.index = Map.copyOf(index);
    }

    /**
     * Builds a grounder from label to reference pairs. When two labels normalize to the same key the
     * first one wins.
     */
    public static LexicalGrounder of(Map<String, Reference> labels) {
        Map<String, Reference> index = new HashMap<>();
        labels.forEach((label, reference) -> {
            String key = normalize(label);
            if (!key.isEmpty()) {
                index.putIfAbsent(key, reference);
            }
        });
        return new LexicalGrounder(index);
    }

    /**
     * Loads a tab separated file of {@code label<TAB>prefix:identifier} lines. Lines starting with
     * {@code #} and blank lines are skipped, files ending in {@code .gz} are decompressed.
     *
     * @param path the label file
     * @return the grounder
     * @throws IOException if the file cannot be read
     */
    public static LexicalGrounder load(Path path) throws IOException {
        log.info("Loading grounding labels from {}", path);
        Map<String, Reference> index = new HashMap<>();
        int lineNumber = 0;
        try (BufferedReader reader = open(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] parts = line.split("\t");
                if (parts.length < 2) {
                    log.warn("Line {} of {} has no reference column, skipping", lineNumber, path);
                    continue;
                }
                try {
                    String key = normalize(parts[0]);
                    if (!key.isEmpty()) {
                        index.putIfAbsent(key, Reference.fromCurie(parts[1].trim()));
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("Line {} of {} has an invalid reference '{}', skipping", lineNumber, path, parts[1]);
                }
            }
        }
        log.info("Loaded {} grounding labels from {}", index.size(), path);
        return new LexicalGrounder(index);
    }

    private static BufferedReader open(Path path) throws IOException {
        if (path.getFileName().toString().endsWith(".gz")) {
            return new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(path)), StandardCharsets.UTF_8));
        }
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public int size() {
        return index.size();
    }

    @Override
    public Optional<Reference> resolve(String text) {
        return Optional.ofNullable(index.get(normalize(text)));
    }
}
