package com.example.dutyroster.common.error;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorLogBufferTest {

    private final Clock clock = Clock.fixed(Instant.parse("2031-03-04T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void keepsNewestEntriesUpToCapacity() {
        ErrorLogBuffer buffer = new ErrorLogBuffer(2, clock);

        buffer.addError("STAFFING", "first", null);
        buffer.addError("STAFFING", "second", new IllegalStateException("boom"));
        buffer.addError("INTERNAL_ERROR", "third", null);

        assertThat(buffer.recent()).extracting(ErrorLogBuffer.Entry::message).containsExactly("third", "second");
        assertThat(buffer.recent().get(1).detail()).isEqualTo("IllegalStateException: boom");
        assertThat(buffer.recent(1)).extracting(ErrorLogBuffer.Entry::code).containsExactly("INTERNAL_ERROR");
    }

    @Test
    void clearEmptiesBuffer() {
        ErrorLogBuffer buffer = new ErrorLogBuffer(10, clock);
        buffer.addError(null, null, null);

        buffer.clear();

        assertThat(buffer.recent()).isEmpty();
    }
}
