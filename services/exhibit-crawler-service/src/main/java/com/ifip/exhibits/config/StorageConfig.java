package com.ifip.exhibits.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ifip.exhibits.client.ExhibitBatchStorage;
import com.ifip.exhibits.client.LocalExhibitBatchStorage;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

    @Bean
    ExhibitBatchStorage exhibitBatchStorage(CrawlerProperties properties, ObjectMapper objectMapper) {
        return new LocalExhibitBatchStorage(Path.of(properties.getOutputPath()), objectMapper);
    }
}
