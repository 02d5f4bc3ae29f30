package com.ifip.exhibits.client;

import java.util.Optional;

public record FetchResult(
    String url,
    byte[] body,
    int statusCode,
    String failureReason
) {
    public static FetchResult success(String url, byte[] body) {
        return completed(url, body, 200);
    }

    public static FetchResult completed(String url, byte[] body, int statusCode) {
        return new FetchResult(url, body, statusCode, null);
    }

    public static FetchResult failure(String url, int statusCode, String reason) {
        return new FetchResult(url, null, statusCode, reason);
    }

    public boolean isSuccessful() {
        return body != null && failureReason == null;
    }

    public Optional<byte[]> content() {
        return isSuccessful() ? Optional.of(body) : Optional.empty();
    }
}
