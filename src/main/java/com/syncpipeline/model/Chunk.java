package com.syncpipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Contiguous slice of a batch. {@code index} is the 0-based position of the chunk in the batch.
 */
public record Chunk<T>(
    int index,
    List<T> records
) {
    public Chunk {
        records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public int size() {
        return records.size();
    }
}
