package com.ifip.exhibits.cache;

import java.util.Optional;

public interface FetchCache {

    Optional<byte[]> get(String fingerprint);

    void put(String fingerprint, String operation, byte[] payload);
}
