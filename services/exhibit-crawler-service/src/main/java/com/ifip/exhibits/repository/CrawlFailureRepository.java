package com.ifip.exhibits.repository;

import com.ifip.exhibits.domain.CrawlFailureEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CrawlFailureRepository extends JpaRepository<CrawlFailureEntity, UUID> {

    List<CrawlFailureEntity> findTop20ByRunIdOrderByCreatedAtDesc(UUID runId);
}
