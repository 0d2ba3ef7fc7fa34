package io.github.drompincen.repowatch.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * All {@code repowatch.*} settings. Secrets are normally supplied through the
 * environment (GITHUB_TOKEN, DINGTALK_WEBHOOK_URL, ...) and mapped in application.yml.
 */
@ConfigurationProperties(prefix = "repowatch")
public class RepoWatchProperties {

    private final GitHub github = new GitHub();
    private final DingTalk dingtalk = new DingTalk();
    private final Mail mail = new Mail();
    private final Scheduler scheduler = new Scheduler();
    private final Worker worker = new Worker();

    public GitHub getGithub() { return github; }
    public DingTalk getDingtalk() { return dingtalk; }
    public Mail getMail() { return mail; }
    public Scheduler getScheduler() { return scheduler; }
    public Worker getWorker() { return worker; }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static class GitHub {
        private String token;
        private String apiUrl = "https://api.github.com";
        private Duration throttle = Duration.ofSeconds(1);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public boolean hasToken() { return hasText(token); }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public Duration getThrottle() { return throttle; }
        public void setThrottle(Duration throttle) { this.throttle = throttle; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class DingTalk {
        private String webhookUrl;
        private String secret;
        private List<String> atMobiles = new ArrayList<>();
        private boolean atAll;

        public boolean isConfigured() { return hasText(webhookUrl); }
        public boolean hasSecret() { return hasText(secret); }

        public String getWebhookUrl() { return webhookUrl; }
        public void setWebhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; }
        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
        public List<String> getAtMobiles() { return atMobiles; }
        public void setAtMobiles(List<String> atMobiles) { this.atMobiles = atMobiles; }
        public boolean isAtAll() { return atAll; }
        public void setAtAll(boolean atAll) { this.atAll = atAll; }
    }

    public static class Mail {
        private String host;
        private int port = 465;
        private String username;
        private String password;
        private List<String> to = new ArrayList<>();
        private boolean ssl = true;

        public boolean isConfigured() {
            return hasText(host) && hasText(username) && hasText(password) && to != null && !to.isEmpty();
        }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public List<String> getTo() { return to; }
        public void setTo(List<String> to) { this.to = to; }
        public boolean isSsl() { return ssl; }
        public void setSsl(boolean ssl) { this.ssl = ssl; }
    }

    public static class Scheduler {
        private long tickIntervalMs = 60_000;
        private Duration lookahead = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofSeconds(180);
        private String timezone = "UTC";
        private Duration defaultLookback = Duration.ofHours(1);

        public ZoneId zoneId() { return ZoneId.of(timezone); }

        public long getTickIntervalMs() { return tickIntervalMs; }
        public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }
        public Duration getLookahead() { return lookahead; }
        public void setLookahead(Duration lookahead) { this.lookahead = lookahead; }
        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
        public String getTimezone() { return timezone; }
        public void setTimezone(String timezone) { this.timezone = timezone; }
        public Duration getDefaultLookback() { return defaultLookback; }
        public void setDefaultLookback(Duration defaultLookback) { this.defaultLookback = defaultLookback; }
    }

    public static class Worker {
        private int poolSize = 4;
        private int queueCapacity = 100;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
