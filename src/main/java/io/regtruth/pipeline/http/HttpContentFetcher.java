package io.regtruth.pipeline.http;

import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.*;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

@Component
public class HttpContentFetcher implements ContentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpContentFetcher.class);

    private static final int BUFFER_SIZE = 8192;

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final PipelineConfig config;

    public HttpContentFetcher(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Fetch a URL with connect/read timeouts and an overall deadline for the body.
     *
     * @param url absolute http(s) URL
     * @return response with the fully read body
     * @throws FetchException classified failure
     */
    @Override
    public FetchResponse fetch(String url) throws FetchException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.trim().isEmpty()) {
                throw new FetchException("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            URL target = URI.create(url.trim()).toURL();
            connection = (HttpURLConnection) target.openConnection();

            configureConnection(connection);

            long deadline = System.nanoTime() + (long) config.http().readTimeout() * 1_000_000L;
            connection.connect();

            int status = validateHttpResponse(connection, url);
            byte[] body = readBody(connection, deadline);

            logger.debug("Fetched {} ({} bytes, status {})", url, body.length, status);
            return new FetchResponse(url, status, connection.getContentType(), body);

        } catch (FetchException e) {
            throw e;

        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new FetchException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FetchException("Timeout fetching: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FetchException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FetchException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (IOException e) {
            throw new FetchException("I/O error fetching " + url + ": " + e.getMessage(), e,
                    ErrorCategory.fromException(e));

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(config.http().connectTimeout());
        connection.setReadTimeout(config.http().readTimeout());

        connection.setRequestProperty("User-Agent", getNextUserAgent());
        connection.setRequestProperty("Accept", "text/html, application/xhtml+xml, application/xml, application/pdf, */*");
        connection.setRequestProperty("Accept-Language", "hr,en;q=0.8");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private int validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FetchException {
        int responseCode = connection.getResponseCode();

        if (responseCode >= 200 && responseCode < 300) {
            return responseCode;
        }

        ErrorCategory category = ErrorCategory.fromStatus(responseCode);
        String message = switch (category) {
            case NOT_FOUND -> "Not found (" + responseCode + "): " + url;
            case ACCESS_FORBIDDEN -> "Access forbidden (403): " + url;
            case AUTH_REQUIRED -> "Authentication required (401): " + url;
            case RATE_LIMITED -> "Rate limited (429): " + url;
            case TIMEOUT -> "Request timeout (408): " + url;
            case SERVER_ERROR -> "Server error (" + responseCode + "): " + url;
            case SERVER_UNAVAILABLE -> "Server temporarily unavailable (" + responseCode + "): " + url;
            default -> String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), url);
        };
        throw new FetchException(message, null, category, responseCode);
    }

    private byte[] readBody(HttpURLConnection connection, long deadlineNanos) throws IOException {
        InputStream raw = connection.getInputStream();
        try (InputStream in = "gzip".equalsIgnoreCase(connection.getContentEncoding())
                ? new GZIPInputStream(raw)
                : raw) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                if (System.nanoTime() > deadlineNanos) {
                    throw new SocketTimeoutException("Response body not completed within deadline");
                }
            }
            return out.toByteArray();
        }
    }

    private String getNextUserAgent() {
        List<String> userAgents = config.http().userAgents();
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }
}
