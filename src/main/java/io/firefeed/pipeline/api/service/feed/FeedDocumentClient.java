package io.firefeed.pipeline.api.service.feed;

import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.firefeed.pipeline.api.exception.ErrorCategory;
import io.firefeed.pipeline.api.exception.FeedFetchException;
import io.firefeed.pipeline.config.HttpConfig;
import io.firefeed.pipeline.config.RssConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

/**
 * Downloads and parses RSS/Atom documents over HTTP.
 * <p>
 * Every failure is reported as a {@link FeedFetchException} carrying an {@link ErrorCategory};
 * {@link #fetchFeed(String)} retries transient categories with exponential backoff.
 */
@Component
public class FeedDocumentClient {

    private static final Logger logger = LoggerFactory.getLogger(FeedDocumentClient.class);

    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final HttpConfig httpConfig;
    private final AtomicInteger userAgentIndex = new AtomicInteger();

    public FeedDocumentClient(RssConfig rssConfig) {
        this.httpConfig = rssConfig.http();
    }

    /**
     * Fetch and parse a feed, retrying timeouts, network errors and 5xx responses.
     *
     * @param url feed URL
     * @return parsed feed, possibly without entries
     * @throws FeedFetchException when the last attempt fails
     */
    @Retryable(
            retryFor = FeedFetchException.class,
            exceptionExpression = "transient",
            maxAttemptsExpression = "#{@rssProps.maxAttempts}",
            backoff = @Backoff(delayExpression = "#{@rssProps.retryDelay}", multiplier = 2.0, maxDelay = 10000)
    )
    public SyndFeed fetchFeed(String url) throws FeedFetchException {
        logger.debug("Fetching feed: {}", url);
        return download(url, httpConfig.connectTimeout(), httpConfig.readTimeout());
    }

    /**
     * Single attempt with caller supplied timeouts, used for validation probes.
     */
    public SyndFeed probe(String url, int timeoutMs) throws FeedFetchException {
        return download(url, timeoutMs, timeoutMs);
    }

    private SyndFeed download(String url, int connectTimeoutMs, int readTimeoutMs) throws FeedFetchException {
        HttpURLConnection connection = null;

        try {
            URI uri = toHttpUri(url);
            connection = (HttpURLConnection) uri.toURL().openConnection();
            configureConnection(connection, connectTimeoutMs, readTimeoutMs);

            connection.connect();
            validateHttpResponse(connection, url);

            byte[] body = readBody(connection, url);
            return parse(body, url);

        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new FeedFetchException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedFetchException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedFetchException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedFetchException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new FeedFetchException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedFetchException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private URI toHttpUri(String url) throws FeedFetchException {
        if (url == null || url.isBlank()) {
            throw new FeedFetchException("URL is null or empty", ErrorCategory.INVALID_URL);
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
                throw new FeedFetchException("Not an http(s) URL: " + url, ErrorCategory.INVALID_URL);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new FeedFetchException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);
        }
    }

    private void configureConnection(HttpURLConnection connection, int connectTimeoutMs, int readTimeoutMs) {
        connection.setConnectTimeout(connectTimeoutMs);
        connection.setReadTimeout(readTimeoutMs);

        connection.setRequestProperty("User-Agent", nextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FeedFetchException {
        int responseCode = connection.getResponseCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK -> {
                String contentType = connection.getContentType();
                if (contentType != null && !isFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
            }
            case HttpURLConnection.HTTP_NOT_FOUND ->
                    throw new FeedFetchException("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);
            case HttpURLConnection.HTTP_FORBIDDEN ->
                    throw new FeedFetchException("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);
            case HttpURLConnection.HTTP_UNAUTHORIZED ->
                    throw new FeedFetchException("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);
            case HTTP_TOO_MANY_REQUESTS ->
                    throw new FeedFetchException("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);
            case HttpURLConnection.HTTP_INTERNAL_ERROR ->
                    throw new FeedFetchException("Server error (500): " + url, ErrorCategory.SERVER_ERROR);
            case HttpURLConnection.HTTP_BAD_GATEWAY,
                 HttpURLConnection.HTTP_UNAVAILABLE,
                 HttpURLConnection.HTTP_GATEWAY_TIMEOUT ->
                    throw new FeedFetchException("Server temporarily unavailable (" + responseCode + "): " + url,
                            ErrorCategory.SERVER_UNAVAILABLE);
            default -> {
                if (responseCode >= 400) {
                    throw new FeedFetchException(
                            String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), url),
                            ErrorCategory.HTTP_ERROR
                    );
                }
            }
        }
    }

    private byte[] readBody(HttpURLConnection connection, String url) throws IOException, FeedFetchException {
        long limit = httpConfig.maxDocumentBytes();
        try (InputStream raw = connection.getInputStream();
             InputStream in = "gzip".equalsIgnoreCase(connection.getContentEncoding()) ? new GZIPInputStream(raw) : raw) {
            byte[] body = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, limit + 1));
            if (body.length > limit) {
                throw new FeedFetchException("Feed document exceeds " + limit + " bytes: " + url, ErrorCategory.IO_ERROR);
            }
            return body;
        }
    }

    private SyndFeed parse(byte[] body, String url) throws IOException, FeedFetchException {
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(body))) {
            SyndFeed feed = new SyndFeedInput().build(reader);
            if (feed == null) {
                throw new FeedFetchException("Feed document is empty: " + url, ErrorCategory.PARSE_ERROR);
            }
            return feed;
        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedFetchException("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        }
    }

    private String nextUserAgent() {
        List<String> userAgents = httpConfig.userAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            return "FireFeed/1.0";
        }
        int index = Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size());
        return userAgents.get(index);
    }

    private boolean isFeedContentType(String contentType) {
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("xml") || lower.contains("rss") || lower.contains("atom") || lower.contains("text");
    }
}
