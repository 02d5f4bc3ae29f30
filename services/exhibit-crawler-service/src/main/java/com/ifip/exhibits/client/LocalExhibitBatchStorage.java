package com.ifip.exhibits.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ifip.exhibits.domain.ExhibitRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

public class LocalExhibitBatchStorage implements ExhibitBatchStorage {

    private static final String EXTENSION = ".jsonl";

    private final Path basePath;
    private final ObjectMapper objectMapper;

    public LocalExhibitBatchStorage(Path basePath, ObjectMapper objectMapper) {
        this.basePath = basePath;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean exists(String batchKey) {
        return Files.isRegularFile(pathOf(batchKey));
    }

    @Override
    public List<ExhibitRecord> read(String batchKey) {
        try {
            List<ExhibitRecord> records = new ArrayList<>();
            for (String line : Files.readAllLines(pathOf(batchKey), StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    records.add(objectMapper.readValue(line, ExhibitRecord.class));
                }
            }
            return records;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read exhibit batch " + batchKey, e);
        }
    }

    @Override
    public String write(String batchKey, List<ExhibitRecord> records) {
        Path target = pathOf(batchKey);
        Path staging = null;
        try {
            Files.createDirectories(basePath);
            staging = Files.createTempFile(basePath, batchKey, ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(staging, StandardCharsets.UTF_8)) {
                for (ExhibitRecord record : records) {
                    writer.write(objectMapper.writeValueAsString(record));
                    writer.write('\n');
                }
            }
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return target.toAbsolutePath().toString();
        } catch (IOException e) {
            deleteQuietly(staging, e);
            throw new IllegalStateException("Failed to store exhibit batch " + batchKey, e);
        }
    }

    private Path pathOf(String batchKey) {
        if (batchKey.contains("/") || batchKey.contains("\\") || batchKey.contains("..")) {
            throw new IllegalArgumentException("Invalid batch key: " + batchKey);
        }
        return basePath.resolve(batchKey + EXTENSION);
    }

    private void deleteQuietly(Path staging, IOException failure) {
        if (staging == null) {
            return;
        }
        try {
            Files.deleteIfExists(staging);
        } catch (IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
        }
    }
}
