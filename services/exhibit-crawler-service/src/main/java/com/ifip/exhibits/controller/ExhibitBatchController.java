package com.ifip.exhibits.controller;

import com.ifip.exhibits.client.ExhibitBatchStorage;
import com.ifip.exhibits.exhibit.ExhibitLocator;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/exhibits")
public class ExhibitBatchController {

    private final ExhibitBatchStorage batchStorage;

    public ExhibitBatchController(ExhibitBatchStorage batchStorage) {
        this.batchStorage = batchStorage;
    }

    @GetMapping
    public BatchView list(@RequestParam String indexHtmlUrl) {
        String batchKey = ExhibitLocator.pageKey(indexHtmlUrl);
        if (!batchStorage.exists(batchKey)) {
            throw new IllegalArgumentException("No exhibit batch stored for " + indexHtmlUrl);
        }
        List<ExhibitResponse> exhibits = batchStorage.read(batchKey)
            .stream()
            .map(ExhibitResponse::from)
            .toList();
        return new BatchView(indexHtmlUrl, batchKey, exhibits);
    }

    public record BatchView(String indexHtmlUrl, String batchKey, List<ExhibitResponse> exhibits) {
    }
}
