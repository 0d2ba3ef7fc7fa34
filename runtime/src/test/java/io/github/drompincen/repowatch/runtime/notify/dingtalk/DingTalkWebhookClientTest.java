package io.github.drompincen.repowatch.runtime.notify.dingtalk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.notify.NotificationMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DingTalkWebhookClientTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String WEBHOOK = "https://oapi.dingtalk.com/robot/send?access_token=abc";

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;
    @Captor private ArgumentCaptor<HttpRequest> requestCaptor;

    private final ObjectMapper mapper = new ObjectMapper();
    private RepoWatchProperties properties;
    private DingTalkWebhookClient client;

    @BeforeEach
    void setUp() throws Exception {
        properties = new RepoWatchProperties();
        properties.getDingtalk().setWebhookUrl(WEBHOOK);
        client = new DingTalkWebhookClient(httpClient, mapper, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"errcode\":0,\"errmsg\":\"ok\"}");
        doReturn(response).when(httpClient).send(any(), any());
    }

    @Test
    void sign_isUrlEncodedBase64HmacOfTimestampAndSecret() throws Exception {
        String secret = "SEC-test-secret";
        long timestamp = NOW.toEpochMilli();

        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] expected = mac.doFinal((timestamp + "\n" + secret).getBytes(StandardCharsets.UTF_8));

        String sign = DingTalkWebhookClient.sign(timestamp, secret);

        assertThat(sign).doesNotContain("+", "/", "=");
        byte[] decoded = Base64.getDecoder().decode(URLDecoder.decode(sign, StandardCharsets.UTF_8));
        assertThat(decoded).isEqualTo(expected);
    }

    @Test
    void signedUrl_appendsWithMatchingSeparator() {
        assertThat(DingTalkWebhookClient.signedUrl(WEBHOOK, 1L, "s"))
                .startsWith(WEBHOOK + "&timestamp=1&sign=");
        assertThat(DingTalkWebhookClient.signedUrl("https://hook.test/send", 1L, "s"))
                .startsWith("https://hook.test/send?timestamp=1&sign=");
    }

    @Test
    void send_withSecret_signsRequestUrl() throws Exception {
        properties.getDingtalk().setSecret("SEC-test-secret");

        client.send(NotificationMessage.text("hello"));

        verify(httpClient).send(requestCaptor.capture(), any());
        assertThat(requestCaptor.getValue().uri().toString())
                .startsWith(WEBHOOK + "&timestamp=" + NOW.toEpochMilli() + "&sign=");
    }

    @Test
    void send_withoutSecret_usesPlainUrl() throws Exception {
        client.send(NotificationMessage.text("hello"));

        verify(httpClient).send(requestCaptor.capture(), any());
        assertThat(requestCaptor.getValue().uri().toString()).isEqualTo(WEBHOOK);
    }

    @Test
    void nonZeroErrcode_isReturnedNotThrown() throws Exception {
        when(response.body()).thenReturn("{\"errcode\":310000,\"errmsg\":\"sign not match\"}");

        DingTalkResponse result = client.send(NotificationMessage.markdown("t", "b"));

        assertThat(result.isOk()).isFalse();
        assertThat(result.errcode()).isEqualTo(310000);
    }

    @Test
    void body_carriesMessageKindAndMentions() {
        properties.getDingtalk().setAtMobiles(List.of("13800000000"));

        ObjectNode markdown = client.body(NotificationMessage.markdown("Title", "## body"));
        assertThat(markdown.path("msgtype").asText()).isEqualTo("markdown");
        assertThat(markdown.path("markdown").path("title").asText()).isEqualTo("Title");
        assertThat(markdown.path("markdown").path("text").asText()).isEqualTo("## body");
        assertThat(markdown.path("at").path("atMobiles").get(0).asText()).isEqualTo("13800000000");
        assertThat(markdown.path("at").path("isAtAll").asBoolean()).isFalse();

        ObjectNode link = client.body(NotificationMessage.link("T", "txt", "https://github.com/octo/repo"));
        assertThat(link.path("link").path("messageUrl").asText()).isEqualTo("https://github.com/octo/repo");
    }

    @Test
    void body_withoutMentions_hasNoAtBlock() {
        ObjectNode text = client.body(NotificationMessage.text("hi"));

        assertThat(text.path("text").path("content").asText()).isEqualTo("hi");
        assertThat(text.has("at")).isFalse();
    }
}
