package io.github.drompincen.repowatch.runtime.notify.email;

import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.notify.ChannelResult;
import io.github.drompincen.repowatch.runtime.notify.NotificationBatch;
import io.github.drompincen.repowatch.runtime.notify.NotificationChannel;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

/**
 * SMTP channel. The mail sender is built from {@code repowatch.mail.*} rather than
 * {@code spring.mail.*} so the channel stays inert until all SMTP settings are present.
 */
@Component
@Order(2)
public class EmailChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(EmailChannel.class);

    private final RepoWatchProperties.Mail config;
    private final EmailReportRenderer renderer;
    private volatile JavaMailSender mailSender;

    public EmailChannel(RepoWatchProperties properties, EmailReportRenderer renderer) {
        this(properties, renderer, null);
    }

    EmailChannel(RepoWatchProperties properties, EmailReportRenderer renderer, JavaMailSender mailSender) {
        this.config = properties.getMail();
        this.renderer = renderer;
        this.mailSender = mailSender;
    }

    @Override
    public String name() { return "email"; }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public ChannelResult send(NotificationBatch batch) throws MessagingException {
        List<NotificationBatch> batches = List.of(batch);
        JavaMailSender sender = sender();

        MimeMessage message = sender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
        helper.setFrom(config.getUsername());
        helper.setTo(config.getTo().toArray(new String[0]));
        helper.setSubject(renderer.subject(batches));
        helper.setText(renderer.render(batches), true);

        sender.send(message);
        log.info("Email report for {} sent to {}", batch.fullName(), config.getTo());
        return ChannelResult.sent(name());
    }

    private JavaMailSender sender() {
        JavaMailSender sender = mailSender;
        if (sender == null) {
            synchronized (this) {
                if (mailSender == null) {
                    mailSender = buildSender(config);
                }
                sender = mailSender;
            }
        }
        return sender;
    }

    static JavaMailSenderImpl buildSender(RepoWatchProperties.Mail config) {
        JavaMailSenderImpl impl = new JavaMailSenderImpl();
        impl.setHost(config.getHost());
        impl.setPort(config.getPort());
        impl.setUsername(config.getUsername());
        impl.setPassword(config.getPassword());
        impl.setDefaultEncoding(StandardCharsets.UTF_8.name());

        Properties props = impl.getJavaMailProperties();
        props.put("mail.smtp.auth", "true");
        if (config.isSsl()) {
            props.put("mail.smtp.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", "true");
        }
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "30000");
        props.put("mail.smtp.writetimeout", "30000");
        return impl;
    }
}
