package com.ifip.exhibits.support;

import com.ifip.exhibits.client.ExhibitBatchStorage;
import com.ifip.exhibits.domain.ExhibitRecord;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class RecordingBatchStorage implements ExhibitBatchStorage {

    private final Map<String, List<ExhibitRecord>> batches = new HashMap<>();
    private int writes;

    @Override
    public boolean exists(String batchKey) {
        return batches.containsKey(batchKey);
    }

    @Override
    public List<ExhibitRecord> read(String batchKey) {
        return batches.get(batchKey);
    }

    @Override
    public String write(String batchKey, List<ExhibitRecord> records) {
        writes++;
        batches.put(batchKey, List.copyOf(records));
        return "memory:" + batchKey;
    }

    public int writes() {
        return writes;
    }
}
