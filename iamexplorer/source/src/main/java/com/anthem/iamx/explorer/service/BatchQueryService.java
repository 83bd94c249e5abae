package com.anthem.iamx.explorer.service;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.graph.exception.IamGraphException;
import com.anthem.iamx.graph.exception.QueryCancelledException;
import com.anthem.iamx.graph.query.QueryEngine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs many queries concurrently against one shared graph.
 *
 * <p>Every request yields exactly one {@link QueryOutcome}, in request order. A request that
 * fails (unknown identity, malformed pattern, unparsable line) becomes a FAILED outcome and
 * never aborts the batch. Requests still running when the batch timeout expires are
 * interrupted and reported as TIMEOUT.
 */
@Slf4j
@Service
public class BatchQueryService {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final ExecutorService executor;
    private final Duration timeout;

    public BatchQueryService(IamxProperties properties) {
        int workers = Math.max(1, properties.getBatch().getWorkers());
        this.timeout = properties.getBatch().getTimeout();
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "iamx-query-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Parse and run the lines of a batch file. Blank lines and lines starting with
     * {@code #} are skipped.
     */
    public List<QueryOutcome> runLines(QueryEngine engine, List<String> lines) {
        List<QueryOutcome> outcomes = new ArrayList<>();
        List<Integer> pending = new ArrayList<>();
        List<QueryRequest> requests = new ArrayList<>();

        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            try {
                requests.add(QueryRequest.parse(trimmed));
                pending.add(outcomes.size());
                outcomes.add(null);
            } catch (IamGraphException e) {
                log.warn("Skipping batch line: line={}, error={}", trimmed, e.getMessage());
                outcomes.add(QueryOutcome.failed(trimmed, e.getErrorCode(), e.getMessage()));
            }
        }

        List<QueryOutcome> results = runAll(engine, requests);
        for (int i = 0; i < pending.size(); i++) {
            outcomes.set(pending.get(i), results.get(i));
        }
        return outcomes;
    }

    /**
     * Run the requests on the worker pool and wait for all of them, or for the timeout.
     *
     * @throws QueryCancelledException if the calling thread is interrupted while waiting
     */
    public List<QueryOutcome> runAll(QueryEngine engine, List<QueryRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        List<Callable<QueryOutcome>> tasks = new ArrayList<>();
        for (QueryRequest request : requests) {
            tasks.add(() -> execute(engine, request));
        }

        long startTime = System.currentTimeMillis();
        List<Future<QueryOutcome>> futures;
        try {
            futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("batch of " + requests.size() + " queries");
        }

        List<QueryOutcome> outcomes = new ArrayList<>(requests.size());
        int timedOut = 0;
        for (int i = 0; i < futures.size(); i++) {
            String query = requests.get(i).describe();
            try {
                outcomes.add(futures.get(i).get());
            } catch (CancellationException e) {
                timedOut++;
                outcomes.add(QueryOutcome.timedOut(query));
            } catch (ExecutionException e) {
                log.error("Batch query failed unexpectedly: query={}", query, e.getCause());
                outcomes.add(QueryOutcome.failed(query, INTERNAL_ERROR, String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new QueryCancelledException(query);
            }
        }

        if (timedOut > 0) {
            log.warn("Batch timed out: timeoutMs={}, timedOut={}, total={}", timeout.toMillis(), timedOut, requests.size());
        }
        log.info("Batch completed: queries={}, failed={}, timeMs={}", requests.size(),
                outcomes.stream().filter(o -> !o.isSuccess()).count(), System.currentTimeMillis() - startTime);
        return outcomes;
    }

    /**
     * Run one request on the calling thread. Query errors become a FAILED outcome.
     */
    public QueryOutcome execute(QueryEngine engine, QueryRequest request) {
        String query = request.describe();
        try {
            if (request.getType() == QueryRequest.Type.WHO_CAN_DO) {
                return QueryOutcome.whoCanDo(query, engine.whoCanDoReport(request.getAction(), request.getResource()));
            }
            return QueryOutcome.whatCanDo(query, engine.whatCanDo(request.getIdentity()));
        } catch (IamGraphException e) {
            log.warn("Query failed: query={}, code={}, message={}", query, e.getErrorCode(), e.getMessage());
            return QueryOutcome.failed(query, e.getErrorCode(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
