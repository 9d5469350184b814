package de.vzg.pubmed.tools.acquisition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import org.apache.hc.client5.http.HttpResponseException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.BasicHttpClientResponseHandler;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Resolves a {@link FileSet} to local file paths, downloading files from the NCBI FTP server over HTTPS
 * when needed. Every returned path exists and is readable.
 */
@Service
public class ArticleFileService {

    private static final Logger log = LoggerFactory.getLogger(ArticleFileService.class);

    private static final String FILE_PREFIX = "pubmed";
    private static final String FILE_SUFFIX = ".xml.gz";

    private final CloseableHttpClient httpClient;
    private final Path dataDirectory;
    private final int downloadWorkers;

    @Autowired
    public ArticleFileService(CloseableHttpClient httpClient,
        @Value("${pubmed.data-dir}") Path dataDirectory,
        @Value("${pubmed.download.workers:4}") int downloadWorkers) {
        this.httpClient = httpClient;
        this.dataDirectory = dataDirectory;
        this.downloadWorkers = Math.max(1, downloadWorkers);
    }

    public Path getDirectory(FileSet fileSet) {
        return dataDirectory.resolve(fileSet.getDirectoryName());
    }

    /**
     * Lists the files of a file set, newest first.
     *
     * @param fileSet baseline or updates
     * @param source list remotely and download, or use what is on disk
     * @param forceListing fetch the remote directory listing again even if a copy is kept locally
     * @return local paths of the files
     * @throws AcquisitionException if listing or downloading fails
     */
    public List<Path> listFiles(FileSet fileSet, FileSource source, boolean forceListing) {
        return switch (source) {
            case REMOTE -> downloadAll(fileSet, listRemoteUrls(fileSet, forceListing));
            case LOCAL -> listLocalFiles(fileSet);
        };
    }

    public List<Path> listLocalFiles(FileSet fileSet) {
        Path directory = getDirectory(fileSet);
        if (!Files.isDirectory(directory)) {
            log.warn("No local {} directory at {}", fileSet, directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX))
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                .toList();
        } catch (IOException e) {
            throw new AcquisitionException("Could not list " + directory, e);
        }
    }

    /**
     * @return the absolute URLs of all PubMed files in the remote listing, newest first
     */
    public List<String> listRemoteUrls(FileSet fileSet, boolean forceListing) {
        Path indexPath = dataDirectory.resolve(fileSet.getIndexFileName());
        String html;
        try {
            if (Files.isRegularFile(indexPath) && !forceListing) {
                log.debug("Using cached listing {}", indexPath);
                html = Files.readString(indexPath, StandardCharsets.UTF_8);
            } else {
                log.info("Fetching listing of {}", fileSet.getBaseUrl());
                html = httpClient.execute(new HttpGet(fileSet.getBaseUrl()), new BasicHttpClientResponseHandler());
                Files.createDirectories(indexPath.getParent());
                Files.writeString(indexPath, html, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new AcquisitionException("Could not list " + fileSet.getBaseUrl(), e);
        }
        List<String> urls = extractFileUrls(fileSet.getBaseUrl(), html);
        log.info("Listing of {} contains {} files", fileSet, urls.size());
        return urls;
    }

    /**
     * Extracts the links to {@code pubmed*.xml.gz} files from a directory listing page.
     *
     * @param baseUrl the URL of the listing, ending in a slash
     * @param html the listing page
     * @return absolute file URLs in reverse lexicographic order
     */
    public static List<String> extractFileUrls(String baseUrl, String html) {
        List<String> urls = new ArrayList<>();
        for (Element link : Jsoup.parse(html, baseUrl).select("a[href]")) {
            String href = link.attr("href");
            if (href.startsWith(FILE_PREFIX) && href.endsWith(FILE_SUFFIX)) {
                urls.add(baseUrl + href);
            }
        }
        return urls.stream().distinct().sorted(Comparator.reverseOrder()).toList();
    }

    private List<Path> downloadAll(FileSet fileSet, List<String> urls) {
        Path directory = getDirectory(fileSet);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new AcquisitionException("Could not create " + directory, e);
        }
        ExecutorService executor = Executors.newFixedThreadPool(downloadWorkers);
        try {
            List<Future<Path>> futures = new ArrayList<>(urls.size());
            for (String url : urls) {
                futures.add(executor.submit(() -> download(url, directory)));
            }
            List<Path> paths = new ArrayList<>(urls.size());
            for (Future<Path> future : futures) {
                paths.add(future.get());
            }
            return paths;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AcquisitionException acquisitionException) {
                throw acquisitionException;
            }
            throw new AcquisitionException("Downloading " + fileSet + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionException("Interrupted while downloading " + fileSet, e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Downloads one file unless it is already present. The file is written under a temporary name and
     * renamed once complete.
     */
    Path download(String url, Path directory) {
        Path target = directory.resolve(url.substring(url.lastIndexOf('/') + 1));
        if (Files.isRegularFile(target)) {
            return target;
        }
        log.debug("Downloading {} to {}", url, target);
        try {
            Path tempFile = Files.createTempFile(directory, target.getFileName().toString(), ".part");
            try {
                httpClient.execute(new HttpGet(url), response -> {
                    if (response.getCode() >= 300) {
                        throw new HttpResponseException(response.getCode(), response.getReasonPhrase());
                    }
                    try (InputStream is = response.getEntity().getContent()) {
                        Files.copy(is, tempFile, StandardCopyOption.REPLACE_EXISTING);
                    }
                    return tempFile;
                });
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tempFile);
            }
        } catch (IOException e) {
            throw new AcquisitionException("Could not download " + url, e);
        }
        return target;
    }
}
