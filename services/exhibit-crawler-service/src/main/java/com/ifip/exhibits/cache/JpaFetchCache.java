package com.ifip.exhibits.cache;

import com.ifip.exhibits.domain.FetchCacheEntryEntity;
import com.ifip.exhibits.repository.FetchCacheEntryRepository;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaFetchCache implements FetchCache {

    private final FetchCacheEntryRepository repository;

    public JpaFetchCache(FetchCacheEntryRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<byte[]> get(String fingerprint) {
        return repository.findById(fingerprint).map(FetchCacheEntryEntity::getPayload);
    }

    @Override
    @Transactional
    public void put(String fingerprint, String operation, byte[] payload) {
        FetchCacheEntryEntity entry = repository.findById(fingerprint)
            .map(existing -> {
                existing.overwrite(operation, payload);
                return existing;
            })
            .orElseGet(() -> FetchCacheEntryEntity.of(fingerprint, operation, payload));
        repository.save(entry);
    }
}
