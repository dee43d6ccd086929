package com.assettrack.inventory.importer;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ValueCoercionTest {

    @Test
    void parseDateTime_acceptedFormats() {
        assertThat(ValueCoercion.parseDateTime("2024-03-01")).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(ValueCoercion.parseDateTime("3/1/2024")).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(ValueCoercion.parseDateTime("2024-03-01T10:15:30")).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 15, 30));
        assertThat(ValueCoercion.parseDateTime("2024-03-01T10:15:30+02:00")).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 15, 30));
        assertThat(ValueCoercion.parseDateTime("2024-03-01T10:15Z")).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 15));
    }

    @Test
    void parseDateTime_rejectsGarbage() {
        assertThat(ValueCoercion.parseDateTime("2024-13-01")).isNull();
        assertThat(ValueCoercion.parseDateTime("yesterday")).isNull();
        assertThat(ValueCoercion.parseDateTime("")).isNull();
    }

    @Test
    void coerced_distinguishesMissingFromMalformed() {
        assertThat(ValueCoercion.toDate(null).isMissing()).isTrue();
        assertThat(ValueCoercion.toDate(null).isMalformed()).isFalse();
        assertThat(ValueCoercion.toDateTime("soon").isMalformed()).isTrue();
        assertThat(ValueCoercion.toDateTime("2024-01-01").isMalformed()).isFalse();
    }

    @Test
    void toLongOrZero() {
        assertThat(ValueCoercion.toLongOrZero(" 17 ")).isEqualTo(17L);
        assertThat(ValueCoercion.toLongOrZero("1.5")).isZero();
        assertThat(ValueCoercion.toLongOrZero(null)).isZero();
    }
}
