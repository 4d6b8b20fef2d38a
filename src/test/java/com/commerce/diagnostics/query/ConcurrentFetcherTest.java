package com.commerce.diagnostics.query;

import com.commerce.diagnostics.config.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrentFetcherTest {

    private ExecutorService pool;
    private EngineConfig engineConfig;
    private ConcurrentFetcher fetcher;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        engineConfig = new EngineConfig();
        engineConfig.setQueryTimeoutMs(2000);
        fetcher = new ConcurrentFetcher(pool, engineConfig);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void fetchAll_runsConcurrentlyAndKeepsOrder() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        Supplier<String> current = () -> awaitOther(bothStarted, "current");
        Supplier<String> baseline = () -> awaitOther(bothStarted, "baseline");

        assertThat(fetcher.fetchAll(List.of(current, baseline))).containsExactly("current", "baseline");
    }

    @Test
    void fetchAll_oneFails_wholeCallFails() {
        Supplier<String> ok = () -> "rows";
        Supplier<String> broken = () -> {
            throw new DataFetchException("connection refused");
        };

        assertThatThrownBy(() -> fetcher.fetchAll(List.of(ok, broken)))
                .isInstanceOf(DataFetchException.class)
                .hasMessage("connection refused");
    }

    @Test
    void fetchAll_slowTask_timesOut() {
        engineConfig.setQueryTimeoutMs(100);
        Supplier<String> slow = () -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        };

        assertThatThrownBy(() -> fetcher.fetchAll(List.of(slow, () -> "fast")))
                .isInstanceOf(QueryTimeoutException.class)
                .hasMessage("Query timeout after 100ms");
    }

    @Test
    void fetchAll_runtimeFailureRethrownAsIs() {
        Supplier<String> sneaky = () -> {
            throw new IllegalStateException("bad row");
        };

        assertThatThrownBy(() -> fetcher.fetchAll(List.of(sneaky)))
                .isInstanceOf(IllegalStateException.class);
    }

    private static String awaitOther(CountDownLatch latch, String result) {
        latch.countDown();
        try {
            if (!latch.await(1, TimeUnit.SECONDS)) {
                throw new IllegalStateException("fetches did not overlap");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return result;
    }
}
