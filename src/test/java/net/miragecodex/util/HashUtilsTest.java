package net.miragecodex.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HashUtilsTest {

    @Test
    void should_ReturnKnownDigest_When_HashingAbc() {
        assertThat(HashUtils.sha256Hex("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void should_FoldFirstEightBytes_When_DerivingLongKey() {
        assertThat(HashUtils.sha256Long("abc")).isEqualTo(0xba7816bf8f01cfeaL);
    }

    @Test
    void should_RejectNull_When_Hashing() {
        assertThatThrownBy(() -> HashUtils.sha256Hex(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
