package io.github.drompincen.repowatch.runtime.github;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.runtime.github.EventPayload.IssuePayload;
import io.github.drompincen.repowatch.runtime.github.EventPayload.OtherPayload;
import io.github.drompincen.repowatch.runtime.github.EventPayload.PullRequestPayload;
import io.github.drompincen.repowatch.runtime.github.EventPayload.PushPayload;
import io.github.drompincen.repowatch.runtime.github.EventPayload.RefPayload;
import io.github.drompincen.repowatch.runtime.github.EventPayload.ReleasePayload;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one element of the GitHub {@code /repos/{owner}/{repo}/events} array into a
 * {@link NormalizedEvent}. Missing fields fall back to empty values rather than failing.
 */
public class GitHubEventParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public GitHubEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NormalizedEvent parse(JsonNode node) {
        String githubType = node.path("type").asText("");
        EventKind kind = EventKind.fromGithubType(githubType);
        JsonNode payload = node.path("payload");

        return new NormalizedEvent(
                node.path("id").asText(""),
                kind,
                githubType,
                node.path("actor").path("login").asText("Unknown"),
                parseInstant(node.path("created_at").asText(null)),
                node.path("repo").path("name").asText(""),
                payloadFor(kind, payload),
                rawPayload(payload));
    }

    static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private EventPayload payloadFor(EventKind kind, JsonNode payload) {
        switch (kind) {
            case PUSH: {
                List<String> messages = new ArrayList<>();
                for (JsonNode commit : payload.path("commits")) {
                    messages.add(commit.path("message").asText(""));
                }
                return new PushPayload(payload.path("ref").asText(""), payload.path("size").asInt(0), messages);
            }
            case ISSUES: {
                JsonNode issue = payload.path("issue");
                return new IssuePayload(payload.path("action").asText(""),
                        issue.path("number").asLong(0),
                        issue.path("title").asText("Unknown issue"),
                        issue.path("html_url").asText(null));
            }
            case PULL_REQUEST: {
                JsonNode pr = payload.path("pull_request");
                return new PullRequestPayload(payload.path("action").asText(""),
                        pr.path("number").asLong(0),
                        pr.path("title").asText("Unknown PR"),
                        pr.path("html_url").asText(null));
            }
            case CREATE_REF:
            case DELETE_REF:
                return new RefPayload(payload.path("ref_type").asText(""), payload.path("ref").asText(""));
            case RELEASE: {
                JsonNode release = payload.path("release");
                return new ReleasePayload(payload.path("action").asText(""),
                        release.path("name").asText(null),
                        release.path("tag_name").asText(null),
                        release.path("html_url").asText(null));
            }
            default:
                return new OtherPayload();
        }
    }

    private Map<String, Object> rawPayload(JsonNode payload) {
        if (payload == null || !payload.isObject()) return Map.of();
        return objectMapper.convertValue(payload, MAP_TYPE);
    }
}
