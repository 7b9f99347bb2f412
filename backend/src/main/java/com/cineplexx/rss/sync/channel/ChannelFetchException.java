package com.cineplexx.rss.sync.channel;

public class ChannelFetchException extends Exception {
    private final String channel;

    public ChannelFetchException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
