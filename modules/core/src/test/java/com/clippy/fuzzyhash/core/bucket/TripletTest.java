package com.clippy.fuzzyhash.core.bucket;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class TripletTest {

    @Test
    void shouldHashSaltFirst() {
        Triplet triplet = new Triplet('c', 'b', 'a', 2);
        assertThat(triplet.getHash()).isEqualTo(PearsonHash.hash(2, 'c', 'b', 'a'));
        assertThat(triplet.getHash()).isEqualTo(77);
    }

    @Test
    void shouldDecorrelateDefinitionsBySalt() {
        long distinct = Arrays.stream(TripletDefinition.values())
                .mapToInt(d -> d.triplet('x', 'y', 'z').getHash())
                .distinct()
                .count();
        assertThat(distinct).isGreaterThan(1);
    }

    @Test
    void shouldUseDistinctSalts() {
        assertThat(Arrays.stream(TripletDefinition.values()).mapToInt(TripletDefinition::salt))
                .containsExactly(2, 3, 5, 7, 11, 13);
    }

    @Test
    void shouldNeedAtMostFourPriorBytes() {
        assertThat(Arrays.stream(TripletDefinition.values()).mapToInt(TripletDefinition::requiredHistory).max())
                .hasValue(SlideWindow.CAPACITY - 1);
    }
}
