package com.anamnesis.worker;

public class ChannelClosedException extends WorkerChannelException {
    public ChannelClosedException(String channel, String reason) {
        super("channel " + channel + " is closed: " + reason);
    }

    public ChannelClosedException(String channel, String reason, Throwable cause) {
        super("channel " + channel + " is closed: " + reason, cause);
    }
}
