package io.github.drompincen.repowatch.runtime.notify;

public enum MessageKind {
    TEXT("text"),
    MARKDOWN("markdown"),
    LINK("link");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
