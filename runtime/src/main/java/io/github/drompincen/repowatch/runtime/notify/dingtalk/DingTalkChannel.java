package io.github.drompincen.repowatch.runtime.notify.dingtalk;

import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.notify.ChannelResult;
import io.github.drompincen.repowatch.runtime.notify.MarkdownReportRenderer;
import io.github.drompincen.repowatch.runtime.notify.NotificationBatch;
import io.github.drompincen.repowatch.runtime.notify.NotificationChannel;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class DingTalkChannel implements NotificationChannel {

    private final DingTalkWebhookClient client;
    private final MarkdownReportRenderer renderer;
    private final RepoWatchProperties.DingTalk config;

    public DingTalkChannel(DingTalkWebhookClient client, MarkdownReportRenderer renderer,
                           RepoWatchProperties properties) {
        this.client = client;
        this.renderer = renderer;
        this.config = properties.getDingtalk();
    }

    @Override
    public String name() { return "dingtalk"; }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public ChannelResult send(NotificationBatch batch) throws Exception {
        DingTalkResponse response = client.send(renderer.render(batch));
        if (!response.isOk()) {
            return ChannelResult.failed(name(), "errcode=" + response.errcode() + " errmsg=" + response.errmsg());
        }
        return ChannelResult.sent(name());
    }
}
