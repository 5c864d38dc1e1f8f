package com.clippy.fuzzyhash.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DigestTest {

    private static Digest sample() {
        byte[] body = new byte[Body.LENGTH];
        for (int i = 0; i < body.length; i++) {
            body[i] = (byte) (i * 7);
        }
        return new Digest(new Checksum(0x12), new LValue(0x34), new Q(0x6, 0x5), new Body(body));
    }

    @Test
    void shouldWriteSwappedHeaderAndReversedBody() {
        String hex = sample().toHex();

        assertThat(hex).hasSize(Digest.HEX_LENGTH);
        assertThat(hex).startsWith("214365");
        // body[31] = 31 * 7 = 217 = 0xd9 comes first, body[0] = 0 comes last
        assertThat(hex.substring(6, 8)).isEqualTo("d9");
        assertThat(hex).endsWith("0700");
    }

    @Test
    void shouldParseWhatItWrites() {
        Digest digest = sample();

        Digest parsed = Digest.fromHex(digest.toHex());

        assertThat(parsed).isEqualTo(digest);
        assertThat(parsed.checksum().value()).isEqualTo(0x12);
        assertThat(parsed.lValue().value()).isEqualTo(0x34);
        assertThat(parsed.q().q1Ratio()).isEqualTo(0x6);
        assertThat(parsed.q().q2Ratio()).isEqualTo(0x5);
    }

    @Test
    void shouldAcceptVersionPrefixAndUppercase() {
        Digest digest = sample();

        assertThat(Digest.fromHex("T1" + digest.toHex().toUpperCase())).isEqualTo(digest);
    }

    @Test
    void shouldRejectInvalidHexLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Digest.fromHex("abcd"))
                .withMessageContaining("70 characters");
    }

    @Test
    void shouldRejectInvalidHexCharacters() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Digest.fromHex("z".repeat(Digest.HEX_LENGTH)));
    }

    @Test
    void shouldRejectNullParts() {
        assertThatNullPointerException()
                .isThrownBy(() -> new Digest(null, new LValue(0), new Q(0, 0), new Body(new byte[Body.LENGTH])));
    }

    @Test
    void shouldReturnHexFromToString() {
        Digest digest = sample();
        assertThat(digest.toString()).isEqualTo(digest.toHex());
    }
}
