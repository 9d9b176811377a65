package io.fuelpipelines.fuel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Opens a local file, or streams an {@code http(s)} URL without buffering the body. The ANP
 * portal rejects the default Java user agent, so requests present a browser one.
 */
public class CsvInputOpener implements InputOpener {
    private static final Logger log = LoggerFactory.getLogger(CsvInputOpener.class);
    static final String USER_AGENT = "Mozilla/5.0";

    private final HttpClient http;

    public CsvInputOpener() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30))
                .build());
    }

    public CsvInputOpener(HttpClient http) {
        this.http = http;
    }

    @Override
    public InputStream open(String location) throws SourceUnavailableException {
        if (location == null || location.isBlank()) {
            throw new SourceUnavailableException("No source location given");
        }
        String lower = location.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return openUrl(location);
        }
        Path path = lower.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
        try {
            log.info("Reading {}", path.toAbsolutePath());
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new SourceUnavailableException("Cannot open " + path + ": " + e, e);
        }
    }

    private InputStream openUrl(String url) throws SourceUnavailableException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        try {
            log.info("Downloading {}", url);
            HttpResponse<InputStream> resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
            if (resp.statusCode() != 200) {
                resp.body().close();
                throw new SourceUnavailableException("GET " + url + " returned HTTP " + resp.statusCode());
            }
            return resp.body();
        } catch (IOException e) {
            throw new SourceUnavailableException("GET " + url + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while downloading " + url, e);
        }
    }
}
