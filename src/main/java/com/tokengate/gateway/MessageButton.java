package com.tokengate.gateway;

/**
 * An inline button. Exactly one of {@code callbackData} and {@code url} is set.
 */
public record MessageButton(String label, String callbackData, String url) {

    public static MessageButton callback(String label, String data) {
        return new MessageButton(label, data, null);
    }

    public static MessageButton link(String label, String url) {
        return new MessageButton(label, null, url);
    }
}
