package com.ifip.exhibits.client;

import com.ifip.exhibits.domain.ExhibitRecord;
import java.util.List;

public interface ExhibitBatchStorage {

    boolean exists(String batchKey);

    List<ExhibitRecord> read(String batchKey);

    /**
     * Replaces the batch as a whole; readers never see a partially written batch.
     *
     * @return location of the written batch
     */
    String write(String batchKey, List<ExhibitRecord> records);
}
