package com.resultado.result;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("Kind")
class KindTest {

    @Test
    @DisplayName("keeps the declared order with ERROR as the boundary")
    void declaredOrder() {
        assertThat(Kind.values())
                .containsExactly(
                        Kind.OK,
                        Kind.CREATED,
                        Kind.NO_CONTENT,
                        Kind.ACCEPTED,
                        Kind.ERROR,
                        Kind.CRITICAL,
                        Kind.UNAVAILABLE,
                        Kind.INVALID,
                        Kind.UNPROCESSABLE,
                        Kind.FORBIDDEN,
                        Kind.UNAUTHORIZED,
                        Kind.CONFLICT,
                        Kind.NOT_FOUND,
                        Kind.FAILED_DEPENDENCY);
        assertThat(Kind.ERROR.ordinal()).isEqualTo(4);
    }

    @ParameterizedTest
    @EnumSource(
            value = Kind.class,
            names = {"OK", "CREATED", "NO_CONTENT", "ACCEPTED"})
    @DisplayName("success range")
    void successRange(Kind kind) {
        assertThat(kind.isSuccess()).isTrue();
        assertThat(kind.isFailure()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(
            value = Kind.class,
            names = {"OK", "CREATED", "NO_CONTENT", "ACCEPTED"},
            mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("failure range")
    void failureRange(Kind kind) {
        assertThat(kind.isFailure()).isTrue();
        assertThat(kind.isSuccess()).isFalse();
    }
}
