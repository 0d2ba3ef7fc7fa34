package io.github.drompincen.repowatch.runtime.notify.dingtalk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.notify.NotificationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * Posts text, markdown and link messages to a DingTalk group robot webhook.
 * When a secret is configured every request URL carries {@code timestamp} and
 * {@code sign} parameters. A non-zero {@code errcode} is logged and returned, not thrown.
 */
@Component
public class DingTalkWebhookClient {

    private static final Logger log = LoggerFactory.getLogger(DingTalkWebhookClient.class);
    private static final String HMAC_SHA256 = "HmacSHA256";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RepoWatchProperties.DingTalk config;
    private final Clock clock;

    public DingTalkWebhookClient(HttpClient httpClient, ObjectMapper objectMapper,
                                 RepoWatchProperties properties, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getDingtalk();
        this.clock = clock;
    }

    public DingTalkResponse send(NotificationMessage message) throws IOException, InterruptedException {
        if (!config.isConfigured()) {
            throw new IllegalStateException("DingTalk webhook URL is not configured");
        }
        String url = config.hasSecret()
                ? signedUrl(config.getWebhookUrl(), clock.millis(), config.getSecret())
                : config.getWebhookUrl();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json;charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body(message))))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("DingTalk webhook answered HTTP {}", response.statusCode());
            return new DingTalkResponse(-1, "HTTP " + response.statusCode());
        }
        DingTalkResponse result = objectMapper.readValue(response.body(), DingTalkResponse.class);
        if (result.isOk()) {
            log.info("DingTalk {} message sent", message.kind().wireName());
        } else {
            log.warn("DingTalk send failed: errcode={} errmsg={}", result.errcode(), result.errmsg());
        }
        return result;
    }

    ObjectNode body(NotificationMessage message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("msgtype", message.kind().wireName());
        switch (message.kind()) {
            case TEXT -> root.putObject("text").put("content", message.body());
            case MARKDOWN -> root.putObject("markdown")
                    .put("title", message.title())
                    .put("text", message.body());
            case LINK -> root.putObject("link")
                    .put("title", message.title())
                    .put("text", message.body())
                    .put("messageUrl", message.url())
                    .put("picUrl", "");
        }
        if (!config.getAtMobiles().isEmpty() || config.isAtAll()) {
            ObjectNode at = root.putObject("at");
            ArrayNode mobiles = at.putArray("atMobiles");
            config.getAtMobiles().forEach(mobiles::add);
            at.put("isAtAll", config.isAtAll());
        }
        return root;
    }

    static String signedUrl(String webhookUrl, long timestampMillis, String secret) {
        String separator = webhookUrl.contains("?") ? "&" : "?";
        return webhookUrl + separator + "timestamp=" + timestampMillis + "&sign=" + sign(timestampMillis, secret);
    }

    /**
     * HMAC-SHA256 of {@code "{timestamp}\n{secret}"} keyed by the secret, base64 then URL encoded.
     */
    static String sign(long timestampMillis, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            byte[] digest = mac.doFinal((timestampMillis + "\n" + secret).getBytes(StandardCharsets.UTF_8));
            return URLEncoder.encode(Base64.getEncoder().encodeToString(digest), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
