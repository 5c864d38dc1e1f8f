package com.clippy.fuzzyhash.core.bucket;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SlideWindowTest {

    private static int put(SlideWindow window, int value) {
        long pivot = window.getPivot();
        window.put(value);
        return window.getTripletHashes(pivot).length;
    }

    @Test
    void shouldAdvancePivotOnEachPut() {
        SlideWindow window = new SlideWindow();
        assertThat(window.getPivot()).isZero();

        window.put('a');
        window.put('b');

        assertThat(window.getPivot()).isEqualTo(2);
    }

    @Test
    void shouldGrowTripletCountWhileFilling() {
        SlideWindow window = new SlideWindow();

        assertThat(put(window, 'a')).isZero();
        assertThat(put(window, 'b')).isZero();
        assertThat(put(window, 'c')).isEqualTo(1);
        assertThat(put(window, 'd')).isEqualTo(3);
        assertThat(put(window, 'e')).isEqualTo(6);
        assertThat(put(window, 'f')).isEqualTo(6);
    }

    @Test
    void shouldHashTripletsInDefinitionOrder() {
        SlideWindow window = new SlideWindow();
        window.put('a');
        window.put('b');
        long pivot = window.getPivot();
        window.put('c');
        assertThat(window.getTripletHashes(pivot)).containsExactly(77);

        pivot = window.getPivot();
        window.put('d');
        assertThat(window.getTripletHashes(pivot)).containsExactly(232, 250, 113);
    }

    @Test
    void shouldEvictOldestByte() {
        SlideWindow shifted = new SlideWindow();
        SlideWindow direct = new SlideWindow();
        for (int b : new int[]{'z', 'a', 'b', 'c', 'd'}) {
            shifted.put(b);
        }
        for (int b : new int[]{'y', 'a', 'b', 'c', 'd'}) {
            direct.put(b);
        }

        long shiftedPivot = shifted.getPivot();
        long directPivot = direct.getPivot();
        shifted.put('e');
        direct.put('e');

        assertThat(shifted.getTripletHashes(shiftedPivot)).containsExactly(direct.getTripletHashes(directPivot));
    }

    @Test
    void shouldKeepSeedUntilSecondByte() {
        SlideWindow window = new SlideWindow();
        long pivot = window.getPivot();
        window.put('a');

        assertThat(window.getChecksum(pivot, SlideWindow.CHECKSUM_SEED)).isEqualTo(SlideWindow.CHECKSUM_SEED);

        pivot = window.getPivot();
        window.put('b');
        assertThat(window.getChecksum(pivot, SlideWindow.CHECKSUM_SEED)).isEqualTo(169);
    }

    @Test
    void shouldReportFullWindowFromFifthByte() {
        SlideWindow window = new SlideWindow();
        for (int i = 0; i < 4; i++) {
            long pivot = window.getPivot();
            window.put(i);
            assertThat(window.isFull(pivot)).isFalse();
        }
        long pivot = window.getPivot();
        window.put(4);
        assertThat(window.isFull(pivot)).isTrue();
    }

    @Test
    void shouldRejectStalePivot() {
        SlideWindow window = new SlideWindow();
        window.put('a');
        window.put('b');

        assertThatIllegalStateException()
                .isThrownBy(() -> window.getTripletHashes(0))
                .withMessageContaining("newest byte");
    }
}
