package com.delta.harvester.harvest.fetch;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.harvest.model.FetchResult;
import com.delta.harvester.harvest.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Anonymous single-session HTTP fetcher for listing pages. {@link #recycle()} throws away the
 * cookie jar and moves to the next configured user agent.
 */
@Service
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final String PAGE_PLACEHOLDER = "{page}";

    private final HarvesterProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    private HttpClient client;
    private int userAgentIndex;
    private Instant nextAllowedAt;

    public HttpPageFetcher(HarvesterProperties properties, Clock clock, Sleeper sleeper) {
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.client = newClient();
    }

    @Override
    public synchronized FetchResult fetch(int page) {
        URI uri;
        try {
            uri = URI.create(pageUrl(page));
        } catch (IllegalArgumentException e) {
            return FetchResult.failure(0, "invalid_url", e.getMessage());
        }
        try {
            enforceRequestInterval();
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getSource().getRequestTimeoutSeconds()))
                .header("User-Agent", currentUserAgent())
                .header("Accept", "text/html,application/xhtml+xml")
                .header("Accept-Language", "lv,en;q=0.8")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                return FetchResult.failure(status, "http_status", "status=" + status);
            }
            byte[] body = response.body();
            return new FetchResult(
                body == null ? "" : new String(body, StandardCharsets.UTF_8),
                true,
                status,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return FetchResult.failure(0, "timeout", e.getMessage());
        } catch (IOException e) {
            return FetchResult.failure(0, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(0, "interrupted", e.getMessage());
        } finally {
            nextAllowedAt = clock.instant().plusMillis(properties.getSource().getMinRequestIntervalMs());
        }
    }

    @Override
    public synchronized void recycle() {
        List<String> userAgents = properties.getSource().getUserAgents();
        userAgentIndex = (userAgentIndex + 1) % userAgents.size();
        client = newClient();
        log.debug("Recycled HTTP session, user agent #{}", userAgentIndex);
    }

    String pageUrl(int page) {
        String template = properties.getSource().getPageUrlTemplate();
        if (template.contains(PAGE_PLACEHOLDER)) {
            return template.replace(PAGE_PLACEHOLDER, Integer.toString(page));
        }
        return template + (template.contains("?") ? "&" : "?") + "page=" + page;
    }

    String currentUserAgent() {
        List<String> userAgents = properties.getSource().getUserAgents();
        return HarvesterProperties.normalizeUserAgent(userAgents.get(userAgentIndex % userAgents.size()));
    }

    private void enforceRequestInterval() throws InterruptedException {
        if (nextAllowedAt == null) {
            return;
        }
        Duration wait = Duration.between(clock.instant(), nextAllowedAt);
        if (!wait.isNegative() && !wait.isZero()) {
            sleeper.sleep(wait);
        }
    }

    private HttpClient newClient() {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getSource().getRequestTimeoutSeconds()))
            .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }
}
