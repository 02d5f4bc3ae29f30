package com.ifip.exhibits.repository;

import com.ifip.exhibits.domain.FetchCacheEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FetchCacheEntryRepository extends JpaRepository<FetchCacheEntryEntity, String> {

    long countByOperation(String operation);
}
