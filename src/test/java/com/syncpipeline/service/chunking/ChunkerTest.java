package com.syncpipeline.service.chunking;

import com.syncpipeline.model.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkerTest {

    private final Chunker chunker = new Chunker();

    @Test
    @DisplayName("Should split 250 elements into 100, 100, 50")
    void shouldSplitWithRemainderInLastChunk() {
        List<Integer> batch = range(250);

        List<Chunk<Integer>> chunks = chunker.split(batch, 100);

        assertThat(chunks).extracting(Chunk::size).containsExactly(100, 100, 50);
        assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1, 2);
        assertThat(chunks.get(2).records()).first().isEqualTo(200);
    }

    @Test
    @DisplayName("Should produce exactly full chunks when size divides the batch")
    void shouldProduceFullChunksOnExactMultiple() {
        List<Chunk<Integer>> chunks = chunker.split(range(200), 100);

        assertThat(chunks).hasSize(2);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.size()).isEqualTo(100));
    }

    @Test
    @DisplayName("Should return no chunks for an empty batch")
    void shouldReturnNoChunksForEmptyBatch() {
        assertThat(chunker.split(List.of(), 100)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 7, 10, 11, 100})
    @DisplayName("Concatenating chunks should reproduce the batch for any size")
    void concatenationShouldReproduceBatch(int size) {
        List<Integer> batch = range(10);

        List<Integer> rebuilt = new ArrayList<>();
        chunker.split(batch, size).forEach(chunk -> rebuilt.addAll(chunk.records()));

        assertThat(rebuilt).containsExactlyElementsOf(batch);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, -100})
    @DisplayName("Should reject non-positive chunk sizes")
    void shouldRejectNonPositiveSize(int size) {
        assertThatThrownBy(() -> chunker.split(range(5), size))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }

    @Test
    @DisplayName("Chunks should not change when the source list changes afterwards")
    void chunksShouldBeDetachedFromSource() {
        List<Integer> batch = new ArrayList<>(range(4));
        List<Chunk<Integer>> chunks = chunker.split(batch, 2);

        batch.set(0, 99);

        assertThat(chunks.get(0).records()).containsExactly(0, 1);
    }

    private static List<Integer> range(int n) {
        return IntStream.range(0, n).boxed().toList();
    }
}
