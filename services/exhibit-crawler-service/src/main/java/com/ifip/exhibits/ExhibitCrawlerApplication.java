package com.ifip.exhibits;

import com.ifip.exhibits.config.CrawlerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
public class ExhibitCrawlerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExhibitCrawlerApplication.class, args);
    }
}
