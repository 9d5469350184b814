package de.vzg.pubmed.tools.cache;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import org.jdom2.JDOMException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.vzg.pubmed.tools.MedlineFixtures;
import de.vzg.pubmed.tools.medline.ArticleExtractor;
import de.vzg.pubmed.tools.medline.MedlineFileReader;
import de.vzg.pubmed.tools.model.Article;

class ArticleCacheServiceTest {

    @TempDir
    Path tempDir;

    private CountingReader reader;

    @BeforeEach
    void setUp() {
        reader = new CountingReader();
    }

    @Test
    void cachePath() {
        Assertions.assertEquals(Path.of("data", "pubmed25n0001.json.gz"),
            ArticleCacheService.getCachePath(Path.of("data", "pubmed25n0001.xml.gz")));
        Assertions.assertEquals(Path.of("data", "sample.json.gz"),
            ArticleCacheService.getCachePath(Path.of("data", "sample.xml")));
    }

    @Test
    void writesAndReusesCache() throws IOException {
        Path source = MedlineFixtures.copySample(tempDir, "pubmed25n0001.xml");
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);

        List<Article> first = service.process(source, false);
        Assertions.assertTrue(Files.isRegularFile(tempDir.resolve("pubmed25n0001.json.gz")));
        List<Article> second = service.process(source, false);

        Assertions.assertEquals(1, reader.reads.get());
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(12345, second.get(0).pubmed());
        assertNoTempFiles();
    }

    @Test
    void forceProcessIgnoresCache() throws IOException {
        Path source = MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0002.xml.gz"), 1, 2);
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);
        service.process(source, false);
        service.process(source, true);
        Assertions.assertEquals(2, reader.reads.get());
    }

    @Test
    void corruptCacheIsReprocessed() throws IOException {
        Path source = MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0003.xml.gz"), 1, 2);
        Path cache = ArticleCacheService.getCachePath(source);
        Files.writeString(cache, "not gzip", StandardCharsets.UTF_8);

        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);
        Assertions.assertEquals(List.of(1, 2), service.process(source, false).stream().map(Article::pubmed).toList());
        Assertions.assertEquals(1, reader.reads.get());

        // the broken artifact was replaced
        service.process(source, false);
        Assertions.assertEquals(1, reader.reads.get());
    }

    @Test
    void invalidJsonIsReprocessed() throws IOException {
        Path source = MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0004.xml.gz"), 5);
        try (OutputStream os = new GZIPOutputStream(Files.newOutputStream(ArticleCacheService.getCachePath(source)))) {
            os.write("{\"version\":1,\"articles\":[{\"pubmed\":".getBytes(StandardCharsets.UTF_8));
        }
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.NONE);
        Assertions.assertEquals(5, service.process(source, false).get(0).pubmed());
        Assertions.assertEquals(1, reader.reads.get());
    }

    @Test
    void changedSourceIsStale() throws IOException {
        Path source = MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0005.xml.gz"), 1);
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);
        service.process(source, false);

        MedlineFixtures.writeFile(source, 1, 2, 3);
        Files.setLastModifiedTime(source, FileTime.fromMillis(Files.getLastModifiedTime(source).toMillis() + 5000));
        Assertions.assertEquals(3, service.process(source, false).size());
        Assertions.assertEquals(2, reader.reads.get());
    }

    @Test
    void contentFingerprint() throws IOException {
        Path source = MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0006.xml"), 1);
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.SHA256);
        service.process(source, false);
        service.process(source, false);
        Assertions.assertEquals(1, reader.reads.get());

        MedlineFixtures.writeFile(source, 1, 2);
        Assertions.assertEquals(2, service.process(source, false).size());
        Assertions.assertEquals(2, reader.reads.get());
    }

    @Test
    void presenceOnlyIgnoresChanges() throws IOException {
        Path source = MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0007.xml"), 1);
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.NONE);
        service.process(source, false);
        MedlineFixtures.writeFile(source, 1, 2);
        Assertions.assertEquals(1, service.process(source, false).size());
    }

    @Test
    void malformedSourceIsNotCached() throws IOException {
        Path source = tempDir.resolve("pubmed25n0008.xml");
        Files.writeString(source, "<PubmedArticleSet><PubmedArticle>", StandardCharsets.UTF_8);
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);

        Assertions.assertEquals(List.of(), service.process(source, false));
        Assertions.assertFalse(Files.exists(ArticleCacheService.getCachePath(source)));
        service.process(source, false);
        Assertions.assertEquals(2, reader.reads.get());
    }

    @Test
    void truncatedGzipIsNotCached() throws IOException {
        Path source = MedlineFixtures.truncate(MedlineFixtures.writeFile(tempDir.resolve("pubmed25n0010.xml.gz"), 1, 2, 3));
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);

        Assertions.assertEquals(List.of(), service.process(source, false));
        Assertions.assertFalse(Files.exists(ArticleCacheService.getCachePath(source)));
        assertNoTempFiles();
    }

    @Test
    void plainXmlNamedGzIsNotCached() throws IOException {
        Path source = tempDir.resolve("pubmed25n0011.xml.gz");
        Files.writeString(source, "<PubmedArticleSet>" + MedlineFixtures.record(1, "Plain") + "</PubmedArticleSet>",
            StandardCharsets.UTF_8);
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);

        Assertions.assertEquals(List.of(), service.process(source, false));
        Assertions.assertFalse(Files.exists(ArticleCacheService.getCachePath(source)));
    }

    @Test
    void minimalRecordSurvivesCache() throws IOException {
        Path source = tempDir.resolve("pubmed25n0009.xml.gz");
        try (OutputStream os = new GZIPOutputStream(Files.newOutputStream(source))) {
            os.write(("<PubmedArticleSet>" + MedlineFixtures.record(12345, "Test") + "</PubmedArticleSet>")
                .getBytes(StandardCharsets.UTF_8));
        }
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);

        List<Article> parsed = service.process(source, false);
        List<Article> cached = service.process(source, false);
        Assertions.assertEquals(1, reader.reads.get());
        Assertions.assertEquals(parsed, cached);

        Article article = cached.get(0);
        Assertions.assertEquals(12345, article.pubmed());
        Assertions.assertEquals("Test", article.title());
        Assertions.assertEquals(MedlineFixtures.NLM_CATALOG_ID, article.journal().nlmCatalogId());
        Assertions.assertTrue(article.headings().isEmpty());
        Assertions.assertTrue(article.authors().isEmpty());
        Assertions.assertTrue(article.grants().isEmpty());
    }

    @Test
    void missingSourceFails() {
        ArticleCacheService service = new ArticleCacheService(reader, CacheFingerprint.METADATA);
        Assertions.assertThrows(IOException.class, () -> service.process(tempDir.resolve("missing.xml.gz"), false));
    }

    @Test
    void fingerprintNames() {
        Assertions.assertEquals(CacheFingerprint.SHA256, CacheFingerprint.fromName("sha-256"));
        Assertions.assertEquals(CacheFingerprint.METADATA, CacheFingerprint.fromName(" metadata "));
        Assertions.assertEquals(CacheFingerprint.NONE, CacheFingerprint.fromName("none"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CacheFingerprint.fromName("mtime"));
    }

    private void assertNoTempFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            Assertions.assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    private static class CountingReader extends MedlineFileReader {

        final AtomicInteger reads = new AtomicInteger();

        CountingReader() {
            super(new ArticleExtractor());
        }

        @Override
        public List<Article> read(Path path) throws IOException, JDOMException {
            reads.incrementAndGet();
            return super.read(path);
        }
    }
}
