package com.ifip.exhibits.repository;

import com.ifip.exhibits.domain.CrawlRunEntity;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CrawlRunRepository extends JpaRepository<CrawlRunEntity, UUID> {
}
