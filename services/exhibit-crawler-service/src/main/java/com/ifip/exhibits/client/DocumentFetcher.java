package com.ifip.exhibits.client;

public interface DocumentFetcher {

    FetchResult fetch(String url, String userAgent);
}
