package de.vzg.pubmed.tools.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import de.vzg.pubmed.tools.cache.CacheFingerprint;
import de.vzg.pubmed.tools.grounding.Grounder;
import de.vzg.pubmed.tools.grounding.GroundingServices;
import de.vzg.pubmed.tools.grounding.LexicalGrounder;
import de.vzg.pubmed.tools.medline.ArticleExtractor;
import de.vzg.pubmed.tools.medline.MedlineFileReader;

@Configuration
public class ServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfig.class);

    @Value("${pubmed.grounding.organization:}")
    private String organizationLabels;

    @Value("${pubmed.grounding.subject-heading:}")
    private String subjectHeadingLabels;

    @Value("${pubmed.grounding.contributor:}")
    private String contributorLabels;

    @Value("${pubmed.cache.fingerprint:metadata}")
    private String fingerprint;

    @Value("${pubmed.download.workers:4}")
    private int downloadWorkers;

    @Value("${pubmed.http.timeout-seconds:60}")
    private long timeoutSeconds;

    @Bean
    public GroundingServices groundingServices() {
        return new GroundingServices(
            loadGrounder("organization", organizationLabels),
            loadGrounder("subject heading", subjectHeadingLabels),
            loadGrounder("contributor", contributorLabels));
    }

    @Bean
    public ArticleExtractor articleExtractor(GroundingServices groundingServices) {
        return new ArticleExtractor(groundingServices);
    }

    @Bean
    public MedlineFileReader medlineFileReader(ArticleExtractor articleExtractor) {
        return new MedlineFileReader(articleExtractor);
    }

    @Bean
    public CacheFingerprint cacheFingerprint() {
        return CacheFingerprint.fromName(fingerprint);
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient httpClient() {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(Math.max(1, downloadWorkers));
        connectionManager.setDefaultMaxPerRoute(Math.max(1, downloadWorkers));
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.of(timeoutSeconds, TimeUnit.SECONDS))
            .setResponseTimeout(Timeout.of(timeoutSeconds, TimeUnit.SECONDS))
            .build();
        return HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .build();
    }

    private static Grounder loadGrounder(String name, String labels) {
        if (labels == null || labels.isBlank()) {
            log.debug("No {} grounder configured", name);
            return null;
        }
        Path path = Path.of(labels.trim());
        try {
            LexicalGrounder grounder = LexicalGrounder.load(path);
            log.info("Loaded {} {} labels from {}", grounder.size(), name, path);
            return grounder;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load " + name + " labels from " + path, e);
        }
    }
}
