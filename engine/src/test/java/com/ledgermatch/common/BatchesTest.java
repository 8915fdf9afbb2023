package com.ledgermatch.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchesTest {

    @Test
    @DisplayName("chunks keep order and the last chunk holds the remainder")
    void chunksInOrder() {
        List<List<Integer>> chunks = Batches.chunk(List.of(1, 2, 3, 4, 5), 2);

        assertThat(chunks).containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }

    @Test
    @DisplayName("chunks are copies, unaffected by later changes to the source")
    void chunksAreCopies() {
        List<String> source = new ArrayList<>(List.of("a", "b", "c"));
        List<List<String>> chunks = Batches.chunk(source, 3);
        source.set(0, "z");

        assertThat(chunks.get(0)).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("null or empty input gives no chunks")
    void emptyInput() {
        assertThat(Batches.chunk(null, 10)).isEmpty();
        assertThat(Batches.chunk(List.of(), 10)).isEmpty();
    }

    @Test
    @DisplayName("non-positive size is rejected")
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> Batches.chunk(List.of(1), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }
}
