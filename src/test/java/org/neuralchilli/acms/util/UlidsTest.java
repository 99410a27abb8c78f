package org.neuralchilli.acms.util;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UlidsTest {

    @Test
    void shouldGenerateWellFormedUlid() {
        String ulid = Ulids.newUlid();

        assertThat(ulid).hasSize(Ulids.LENGTH).matches("[0-9A-HJKMNP-TV-Z]{26}");
        assertThat(Ulids.isValid(ulid)).isTrue();
    }

    @Test
    void shouldEncodeKnownValues() {
        assertThat(Ulids.encode(0, BigInteger.ZERO)).isEqualTo("00000000000000000000000000");
        assertThat(Ulids.newUlid(Instant.ofEpochMilli(1469918176385L), new byte[10]))
                .startsWith("01ARYZ6S41");
    }

    @Test
    void shouldRoundTripTimestamp() {
        Instant instant = Instant.ofEpochMilli(1_700_000_000_123L);

        assertThat(Ulids.timestampOf(Ulids.newUlid(instant))).isEqualTo(instant);
    }

    @Test
    void shouldSortByCreationTime() {
        String earlier = Ulids.newUlid(Instant.ofEpochMilli(1_000));
        String later = Ulids.newUlid(Instant.ofEpochMilli(2_000));

        assertThat(earlier).isLessThan(later);
    }

    @Test
    void shouldBeUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(Ulids.newUlid());
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    void shouldRejectMalformedValues() {
        assertThat(Ulids.isValid(null)).isFalse();
        assertThat(Ulids.isValid("too-short")).isFalse();
        assertThat(Ulids.isValid("0123456789ABCDEFGHJKMNPQRI")).isFalse();
        assertThat(Ulids.isValid("8ZZZZZZZZZZZZZZZZZZZZZZZZZ")).isFalse();
        assertThatThrownBy(() -> Ulids.timestampOf("nope")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Ulids.newUlid(Instant.now(), new byte[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldStayMonotonicWithinOneMillisecond() {
        Ulids.MonotonicGenerator generator = Ulids.monotonic();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            ids.add(generator.next(1_234_567L));
        }

        assertThat(ids).isSorted().doesNotHaveDuplicates();
        assertThat(ids).allSatisfy(id -> assertThat(Ulids.timestampOf(id).toEpochMilli()).isEqualTo(1_234_567L));
    }
}
