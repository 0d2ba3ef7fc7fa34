package io.github.drompincen.repowatch.runtime.notify;

/**
 * Channel-neutral rendered message. Never persisted.
 *
 * @param url target of a {@link MessageKind#LINK} message, otherwise {@code null}
 */
public record NotificationMessage(MessageKind kind, String title, String body, String url) {

    public static NotificationMessage text(String body) {
        return new NotificationMessage(MessageKind.TEXT, null, body, null);
    }

    public static NotificationMessage markdown(String title, String body) {
        return new NotificationMessage(MessageKind.MARKDOWN, title, body, null);
    }

    public static NotificationMessage link(String title, String body, String url) {
        return new NotificationMessage(MessageKind.LINK, title, body, url);
    }
}
