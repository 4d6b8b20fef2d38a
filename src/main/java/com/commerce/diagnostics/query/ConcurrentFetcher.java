package com.commerce.diagnostics.query;

import com.commerce.diagnostics.config.EngineConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs independent fetches side by side on the fetch pool and joins them.
 * Either all results come back, or the whole call fails; partial results are never returned.
 */
@Component
public class ConcurrentFetcher {

    private final Executor executor;
    private final EngineConfig engineConfig;

    public ConcurrentFetcher(@Qualifier("queryFetchExecutor") Executor executor, EngineConfig engineConfig) {
        this.executor = executor;
        this.engineConfig = engineConfig;
    }

    /**
     * @return results in the order of the tasks
     * @throws QueryTimeoutException if the join exceeds the query timeout
     * @throws DataFetchException    if any task fails
     */
    public <T> List<T> fetchAll(List<Supplier<T>> tasks) {
        List<CompletableFuture<T>> futures = new ArrayList<>(tasks.size());
        try {
            for (Supplier<T> task : tasks) {
                futures.add(CompletableFuture.supplyAsync(task, executor));
            }
        } catch (RejectedExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new DataFetchException("Fetch pool saturated", e);
        }

        long timeoutMs = engineConfig.getQueryTimeoutMs();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            futures.forEach(f -> f.cancel(true));
            throw new QueryTimeoutException("Query timeout after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new DataFetchException("Interrupted while waiting for query results", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new DataFetchException("Query failed: " + cause, cause);
        }

        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            results.add(future.join());
        }
        return results;
    }
}
