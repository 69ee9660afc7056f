package com.polaris.sentiment.api.context;

import com.polaris.sentiment.api.exceptions.CancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestContextTest {

    @Test
    @DisplayName("Background context should never be done")
    void backgroundShouldNeverBeDone() {
        RequestContext ctx = RequestContext.background();

        assertThat(ctx.isDone()).isFalse();
        assertThat(ctx.deadline()).isEmpty();
        assertThat(ctx.remaining()).isEmpty();
        assertThat(ctx.boundTimeout(Duration.ofSeconds(3))).isEqualTo(Duration.ofSeconds(3));
        assertThatCode(ctx::ensureActive).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should report deadline exceeded once the clock reaches the deadline")
    void shouldExpireAtDeadline() {
        MutableClock clock = new MutableClock();
        RequestContext ctx = RequestContext.withTimeout(Duration.ofMillis(500), clock);

        assertThat(ctx.remaining()).contains(Duration.ofMillis(500));
        assertThat(ctx.isDeadlineExceeded()).isFalse();

        clock.advance(Duration.ofMillis(500));

        assertThat(ctx.isDeadlineExceeded()).isTrue();
        assertThat(ctx.isCancelled()).isFalse();
        assertThat(ctx.isDone()).isTrue();
        assertThat(ctx.remaining()).contains(Duration.ZERO);
        assertThatThrownBy(ctx::ensureActive)
                .isInstanceOf(CancelledException.class)
                .hasMessageContaining("deadline");
    }

    @Test
    @DisplayName("Should bound a timeout by the remaining time")
    void shouldBoundTimeout() {
        MutableClock clock = new MutableClock();
        RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(10), clock);

        assertThat(ctx.boundTimeout(Duration.ofSeconds(1))).isEqualTo(Duration.ofSeconds(1));

        clock.advance(Duration.ofMillis(9_700));
        assertThat(ctx.boundTimeout(Duration.ofSeconds(1))).isEqualTo(Duration.ofMillis(300));

        clock.advance(Duration.ofSeconds(5));
        assertThat(ctx.boundTimeout(Duration.ofSeconds(1))).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Cancel should run listeners once")
    void cancelShouldRunListenersOnce() {
        RequestContext ctx = RequestContext.background();
        AtomicInteger calls = new AtomicInteger();
        ctx.onCancel(calls::incrementAndGet);

        ctx.cancel();
        ctx.cancel();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(ctx.isCancelled()).isTrue();
        assertThatThrownBy(ctx::ensureActive)
                .isInstanceOf(CancelledException.class)
                .hasMessageContaining("cancelled");
    }

    @Test
    @DisplayName("Listener registered after cancel should run immediately")
    void lateListenerShouldRunImmediately() {
        RequestContext ctx = RequestContext.background();
        ctx.cancel();

        AtomicInteger calls = new AtomicInteger();
        ctx.onCancel(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Closed registration should not be notified")
    void closedRegistrationShouldNotRun() {
        RequestContext ctx = RequestContext.background();
        AtomicInteger calls = new AtomicInteger();

        try (RequestContext.Registration registration = ctx.onCancel(calls::incrementAndGet)) {
            assertThat(calls.get()).isZero();
        }
        ctx.cancel();

        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("A failing listener should not stop the others")
    void failingListenerShouldNotStopOthers() {
        RequestContext ctx = RequestContext.background();
        AtomicInteger calls = new AtomicInteger();
        ctx.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        ctx.onCancel(calls::incrementAndGet);

        assertThatCode(ctx::cancel).doesNotThrowAnyException();
        assertThat(calls.get()).isEqualTo(1);
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2025-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
