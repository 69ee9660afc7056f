package com.polaris.sentiment.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineResultCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private CaffeineResultCache cache;

    @BeforeEach
    void setUp() {
        cache = CaffeineResultCache.builder()
                .maxSizeMb(1)
                .expireAfterWrite(Duration.ofMinutes(10))
                .recordStats(true)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should return stored payload")
    void shouldReturnStoredPayload() {
        assertThat(cache.set("hello", bytes("payload"))).isTrue();

        assertThat(cache.get("hello")).hasValueSatisfying(
                payload -> assertThat(payload).isEqualTo(bytes("payload")));
    }

    @Test
    @DisplayName("Should miss for unknown key")
    void shouldMissForUnknownKey() {
        assertThat(cache.get("absent")).isEmpty();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    @DisplayName("Should replace an entry wholesale on repeated set")
    void shouldReplaceEntry() {
        cache.set("key", bytes("first"));
        cache.set("key", bytes("second"));

        assertThat(cache.get("key")).hasValueSatisfying(
                payload -> assertThat(payload).isEqualTo(bytes("second")));
    }

    @Test
    @DisplayName("Should isolate stored bytes from caller mutation")
    void shouldCopyPayloads() {
        byte[] original = bytes("abc");
        cache.set("key", original);
        original[0] = 'z';

        byte[] read = cache.get("key").orElseThrow();
        assertThat(read).isEqualTo(bytes("abc"));

        read[1] = 'z';
        assertThat(cache.get("key").orElseThrow()).isEqualTo(bytes("abc"));
    }

    @Test
    @DisplayName("Should expire entries after the TTL")
    void shouldExpireAfterTtl() {
        cache.set("key", bytes("value"));

        nanos.addAndGet(Duration.ofMinutes(9).toNanos());
        assertThat(cache.get("key")).isPresent();

        nanos.addAndGet(Duration.ofMinutes(1).toNanos() + 1);
        assertThat(cache.get("key")).isEmpty();
    }

    @Test
    @DisplayName("Should measure TTL from the latest write")
    void shouldRestartTtlOnOverwrite() {
        cache.set("key", bytes("v1"));
        nanos.addAndGet(Duration.ofMinutes(8).toNanos());
        cache.set("key", bytes("v2"));
        nanos.addAndGet(Duration.ofMinutes(8).toNanos());

        assertThat(cache.get("key")).hasValueSatisfying(
                payload -> assertThat(payload).isEqualTo(bytes("v2")));
    }

    @Test
    @DisplayName("Should drop an entry larger than the memory ceiling")
    void shouldDropOversizedEntry() {
        byte[] huge = new byte[(int) (2 * CaffeineResultCache.BYTES_PER_MB)];

        assertThat(cache.set("huge", huge)).isFalse();
        assertThat(cache.get("huge")).isEmpty();
        assertThat(cache.getMetrics().droppedWrites()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject null key or payload without throwing")
    void shouldRejectNulls() {
        assertThat(cache.set(null, bytes("x"))).isFalse();
        assertThat(cache.set("key", null)).isFalse();
        assertThat(cache.getMetrics().droppedWrites()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should evict entries to stay under the memory ceiling")
    void shouldEvictUnderMemoryPressure() {
        int payloadSize = 100 * 1024;
        for (int i = 0; i < 20; i++) {
            cache.set("key-" + i, new byte[payloadSize]);
        }
        cache.cleanUp();

        ResultCache.CacheMetrics metrics = cache.getMetrics();
        assertThat(metrics.weightedSizeBytes()).isLessThanOrEqualTo(cache.getMaxWeightBytes());
        assertThat(metrics.currentSize()).isLessThan(20);
        assertThat(metrics.evictions()).isPositive();
    }

    @Test
    @DisplayName("Should log size evictions at FINE when enabled")
    void shouldLogEvictions() {
        Logger cacheLogger = Logger.getLogger(CaffeineResultCache.class.getName());
        Level previous = cacheLogger.getLevel();
        List<String> messages = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        capture.setLevel(Level.ALL);
        cacheLogger.setLevel(Level.FINE);
        cacheLogger.addHandler(capture);
        try {
            CaffeineResultCache logging = CaffeineResultCache.builder()
                    .maxSizeMb(1)
                    .logEvictions(true)
                    .executor(Runnable::run)
                    .build();
            for (int i = 0; i < 20; i++) {
                logging.set("key-" + i, new byte[100 * 1024]);
            }
            logging.cleanUp();

            assertThat(messages).anySatisfy(message -> assertThat(message).contains("cause=SIZE"));
        } finally {
            cacheLogger.removeHandler(capture);
            cacheLogger.setLevel(previous);
        }
    }

    @Test
    @DisplayName("Should weigh key characters, payload and overhead")
    void shouldWeighEntries() {
        assertThat(CaffeineResultCache.weigh("abcd", new byte[10]))
                .isEqualTo(8 + 10 + CaffeineResultCache.ENTRY_OVERHEAD_BYTES);
    }

    @Test
    @DisplayName("Should record hits and misses")
    void shouldRecordStats() {
        cache.set("key", bytes("value"));
        cache.get("key");
        cache.get("key");
        cache.get("other");

        ResultCache.CacheMetrics metrics = cache.getMetrics();
        assertThat(metrics.hits()).isEqualTo(2);
        assertThat(metrics.misses()).isEqualTo(1);
        assertThat(metrics.totalRequests()).isEqualTo(3);
        assertThat(metrics.maxSizeBytes()).isEqualTo(CaffeineResultCache.BYTES_PER_MB);
        assertThat(metrics.format()).contains("hits=2");
    }

    @Test
    @DisplayName("Should invalidate and clear entries")
    void shouldInvalidateAndClear() {
        cache.set("a", bytes("1"));
        cache.set("b", bytes("2"));

        cache.invalidate("a");
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).isPresent();

        cache.clear();
        assertThat(cache.get("b")).isEmpty();
    }

    @Test
    @DisplayName("Should reject invalid builder settings")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> CaffeineResultCache.builder().maxSizeMb(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CaffeineResultCache.builder().expireAfterWrite(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should serve concurrent readers and writers")
    void shouldHandleConcurrentAccess() throws Exception {
        CaffeineResultCache shared = CaffeineResultCache.builder()
                .maxSizeMb(16)
                .build();
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    int mismatches = 0;
                    for (int i = 0; i < perThread; i++) {
                        String key = "k-" + (i % 50);
                        String value = "v-" + (i % 50);
                        shared.set(key, bytes(value));
                        Optional<byte[]> read = shared.get("k-" + ((i + id) % 50));
                        if (read.isPresent()
                                && !new String(read.get(), StandardCharsets.UTF_8).equals("v-" + ((i + id) % 50))) {
                            mismatches++;
                        }
                    }
                    return mismatches;
                }));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isZero();
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
