package com.syncpipeline.service.chunking;

import com.syncpipeline.model.Chunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a batch into fixed-size, order-preserving chunks.
 * Purely structural: element contents are never inspected.
 */
@Component
public class Chunker {

    /**
     * Partition {@code batch} into ceil(n / size) chunks. All chunks but the last hold
     * exactly {@code size} elements; the last holds the remainder.
     *
     * @throws IllegalArgumentException if size is not positive
     */
    public <T> List<Chunk<T>> split(List<T> batch, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + size);
        }
        List<Chunk<T>> chunks = new ArrayList<>((batch.size() + size - 1) / size);
        int index = 0;
        for (int i = 0; i < batch.size(); i += size) {
            chunks.add(new Chunk<>(index++, batch.subList(i, Math.min(i + size, batch.size()))));
        }
        return chunks;
    }
}
