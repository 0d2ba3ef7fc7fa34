package io.github.drompincen.repowatch.runtime.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.error.MissingCredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads one page of recent repository events from the GitHub REST API.
 * Transport problems and non-2xx answers degrade to an empty result; only a missing
 * token is raised, since no call can succeed without it.
 */
@Component
public class GitHubEventFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitHubEventFetcher.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GitHubEventParser parser;
    private final RepoWatchProperties.GitHub config;

    public GitHubEventFetcher(HttpClient httpClient, ObjectMapper objectMapper, RepoWatchProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.parser = new GitHubEventParser(objectMapper);
        this.config = properties.getGithub();
    }

    public boolean hasCredential() {
        return config.hasToken();
    }

    /**
     * @param monitored kinds to keep; events of other kinds are dropped
     * @param since only events created strictly after this instant are returned; {@code null} keeps all
     */
    public List<NormalizedEvent> fetch(String owner, String repo, Set<EventKind> monitored, Instant since) {
        if (!hasCredential()) {
            throw new MissingCredentialException("repowatch.github.token");
        }
        String fullName = owner + "/" + repo;

        try {
            throttle();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(trimSlash(config.getApiUrl()) + "/repos/" + fullName + "/events"))
                    .timeout(config.getRequestTimeout())
                    .header("Authorization", "Bearer " + config.getToken())
                    .header("Accept", "application/vnd.github.v3+json")
                    .header("User-Agent", "repowatch")
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.error("Failed to fetch events for {}: HTTP {}", fullName, response.statusCode());
                return List.of();
            }

            JsonNode root = objectMapper.readTree(response.body());
            if (root == null || !root.isArray()) {
                log.warn("Unexpected events response for {}: not an array", fullName);
                return List.of();
            }

            List<NormalizedEvent> events = new ArrayList<>();
            for (JsonNode node : root) {
                EventKind kind = EventKind.fromGithubType(node.path("type").asText(null));
                if (monitored != null && !monitored.contains(kind)) continue;

                NormalizedEvent event = parser.parse(node);
                if (since != null && event.createdAt() != null && !event.createdAt().isAfter(since)) continue;
                events.add(event);
            }
            log.info("Fetched {} events for {}", events.size(), fullName);
            return events;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching events for {}", fullName);
            return List.of();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Error fetching events for {}: {}", fullName, e.getMessage(), e);
            return List.of();
        }
    }

    private void throttle() throws InterruptedException {
        Duration delay = config.getThrottle();
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
