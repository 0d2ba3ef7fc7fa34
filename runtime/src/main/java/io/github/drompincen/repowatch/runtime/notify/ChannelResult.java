package io.github.drompincen.repowatch.runtime.notify;

public record ChannelResult(String channel, Outcome outcome, String detail) {

    public enum Outcome { SENT, SKIPPED, FAILED }

    public static ChannelResult sent(String channel) {
        return new ChannelResult(channel, Outcome.SENT, null);
    }

    public static ChannelResult skipped(String channel) {
        return new ChannelResult(channel, Outcome.SKIPPED, "not configured");
    }

    public static ChannelResult failed(String channel, String detail) {
        return new ChannelResult(channel, Outcome.FAILED, detail);
    }
}
