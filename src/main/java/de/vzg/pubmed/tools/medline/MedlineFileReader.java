package de.vzg.pubmed.tools.medline;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.InputSource;

import de.vzg.pubmed.tools.model.Article;

/**
 * Reads a PubMed XML file ({@code PubmedArticleSet}, optionally gzipped) into articles.
 */
public class MedlineFileReader {

    private static final Logger log = LoggerFactory.getLogger(MedlineFileReader.class);

    private static final String LOAD_EXTERNAL_DTD = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private final ArticleExtractor extractor;

    public MedlineFileReader(ArticleExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * Parses all records of a file. Records with structural problems are logged and skipped, the rest
     * of the file is still read.
     *
     * @param path a {@code .xml} or {@code .xml.gz} file
     * @return the articles in file order
     * @throws IOException if the file cannot be read
     * @throws JDOMException if the file is not well-formed XML
     */
    public List<Article> read(Path path) throws IOException, JDOMException {
        Document document;
        try (InputStream is = open(path)) {
            document = newBuilder().build(is);
        }
        Element root = document.getRootElement();
        List<Element> records = root.getChildren(MedlineUtils.PUBMED_ARTICLE);
        log.debug("Found {} {} records in {}", records.size(), MedlineUtils.PUBMED_ARTICLE, path);

        List<Article> articles = new ArrayList<>(records.size());
        int skipped = 0;
        int failed = 0;
        for (Element record : records) {
            try {
                Optional<Article> article = extractor.extract(record);
                if (article.isPresent()) {
                    articles.add(article.get());
                } else {
                    skipped++;
                }
            } catch (MedlineStructureException e) {
                failed++;
                if (e.getPubmed() == null) {
                    log.warn("Skipping malformed record (PMID text '{}') in {}: {}", MedlineUtils.extractPmid(record),
                        path, e.getMessage());
                } else {
                    log.warn("Skipping malformed record in {}: {}", path, e.getMessage());
                }
            }
        }
        if (skipped > 0 || failed > 0) {
            log.info("{}: {} articles, {} skipped, {} malformed", path.getFileName(), articles.size(), skipped, failed);
        }
        Element deletions = root.getChild("DeleteCitation");
        if (deletions != null) {
            log.debug("{} lists {} deleted citations", path.getFileName(), deletions.getChildren(MedlineUtils.PMID).size());
        }
        return articles;
    }

    private static InputStream open(Path path) throws IOException {
        InputStream is = new BufferedInputStream(Files.newInputStream(path));
        if (path.getFileName().toString().endsWith(".gz")) {
            try {
                return new GZIPInputStream(is);
            } catch (IOException e) {
                is.close();
                throw e;
            }
        }
        return is;
    }

    /**
     * PubMed files reference the NLM DTD by URL. It is never fetched.
     */
    private static SAXBuilder newBuilder() {
        SAXBuilder saxBuilder = new SAXBuilder();
        saxBuilder.setFeature(LOAD_EXTERNAL_DTD, false);
        saxBuilder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
        return saxBuilder;
    }
}
