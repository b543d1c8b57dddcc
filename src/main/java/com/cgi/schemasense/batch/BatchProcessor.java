package com.cgi.schemasense.batch;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.FieldAnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Splits a schema into batches and classifies them on a bounded worker pool.
 * <p>
 * Small schemas form a single batch. Larger schemas get one batch per table, and tables that
 * reach the large-table threshold or exceed the maximum batch size are split into balanced parts.
 */
@Slf4j
@Component
public class BatchProcessor implements DisposableBean {
    private final int smallSchemaThreshold;
    private final int largeTableThreshold;
    private final int maxBatchSize;
    private final int workerLimit;
    private final ExecutorService executorService;
    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private final AtomicInteger processedBatchCount = new AtomicInteger(0);
    private final AtomicInteger failedBatchCount = new AtomicInteger(0);

    public BatchProcessor(ClassificationProperties properties) {
        ClassificationProperties.Batch config = properties.getBatch();
        this.smallSchemaThreshold = config.getSmallSchemaThreshold();
        this.largeTableThreshold = config.getLargeTableThreshold();
        this.maxBatchSize = Math.max(1, config.getMaxBatchSize());
        this.workerLimit = Math.max(1, config.getWorkerLimit());

        // Create thread pool with custom thread factory
        this.executorService = Executors.newFixedThreadPool(workerLimit, r -> {
            Thread t = new Thread(r);
            t.setName("classifier-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("Batch processor initialized with {} workers (max batch size {})", workerLimit, maxBatchSize);
    }

    /**
     * Partitions a schema into batches.
     *
     * @param schema Columns in schema order
     * @return Batches in schema order
     */
    public List<ClassificationBatch> partition(List<ColumnMetadata> schema) {
        List<ClassificationBatch> batches = new ArrayList<>();
        if (schema.isEmpty()) {
            return batches;
        }
        if (schema.size() <= smallSchemaThreshold) {
            batches.add(ClassificationBatch.builder()
                    .batchId(0)
                    .columns(List.copyOf(schema))
                    .part(1)
                    .partCount(1)
                    .build());
            return batches;
        }

        Map<String, List<ColumnMetadata>> byTable = new LinkedHashMap<>();
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (ColumnMetadata column : schema) {
            String table = column.getTableName() != null ? column.getTableName() : "";
            String key = table.toLowerCase(Locale.ROOT);
            byTable.computeIfAbsent(key, k -> new ArrayList<>()).add(column);
            displayNames.putIfAbsent(key, table);
        }

        for (Map.Entry<String, List<ColumnMetadata>> entry : byTable.entrySet()) {
            List<ColumnMetadata> columns = entry.getValue();
            int parts = partsFor(columns.size());
            int base = columns.size() / parts;
            int remainder = columns.size() % parts;
            int from = 0;
            for (int part = 0; part < parts; part++) {
                int size = base + (part < remainder ? 1 : 0);
                batches.add(ClassificationBatch.builder()
                        .batchId(batches.size())
                        .tableName(displayNames.get(entry.getKey()))
                        .columns(List.copyOf(columns.subList(from, from + size)))
                        .part(part + 1)
                        .partCount(parts)
                        .build());
                from += size;
            }
        }
        log.debug("Partitioned {} columns into {} batches", schema.size(), batches.size());
        return batches;
    }

    /**
     * Classifies batches concurrently. A batch that throws or does not finish before the timeout
     * is marked failed and its columns receive fallback results; the other batches are unaffected.
     *
     * @param batches Batches to classify
     * @param classifier Classifies the columns of one batch, in order
     * @param fallback Result for a column of a failed batch
     * @param timeoutMillis Time allowed for all batches together
     * @return One result per batch, in batch order
     */
    public List<BatchResult> process(List<ClassificationBatch> batches,
                                     Function<ClassificationBatch, List<FieldAnalysisResult>> classifier,
                                     Function<ColumnMetadata, FieldAnalysisResult> fallback,
                                     long timeoutMillis) {
        List<Future<List<FieldAnalysisResult>>> futures = new ArrayList<>(batches.size());
        for (ClassificationBatch batch : batches) {
            futures.add(executorService.submit(() -> classifier.apply(batch)));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMillis));
        List<BatchResult> results = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            ClassificationBatch batch = batches.get(i);
            Future<List<FieldAnalysisResult>> future = futures.get(i);
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                List<FieldAnalysisResult> batchResults = future.get(remaining, TimeUnit.NANOSECONDS);
                if (batchResults.size() != batch.getColumns().size()) {
                    throw new IllegalStateException("Batch returned " + batchResults.size() + " results for "
                            + batch.getColumns().size() + " columns");
                }
                results.add(BatchResult.success(batch, batchResults));
                processedBatchCount.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results.add(fail(batch, fallback, "interrupted"));
            } catch (TimeoutException e) {
                future.cancel(true);
                results.add(fail(batch, fallback, "timed out"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Batch {} failed: {}", batch.describe(), cause.getMessage(), cause);
                results.add(fail(batch, fallback, cause.getMessage()));
            } catch (IllegalStateException e) {
                log.error("Batch {} failed: {}", batch.describe(), e.getMessage());
                results.add(fail(batch, fallback, e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Restores schema order across batch results.
     *
     * @param schema Columns in schema order
     * @param batchResults Results of all batches
     * @param fallback Result for a column no batch produced
     * @return One result per column, in schema order
     */
    public List<FieldAnalysisResult> merge(List<ColumnMetadata> schema, List<BatchResult> batchResults,
                                           Function<ColumnMetadata, FieldAnalysisResult> fallback) {
        Map<ColumnMetadata, FieldAnalysisResult> byColumn = new IdentityHashMap<>();
        for (BatchResult batchResult : batchResults) {
            List<ColumnMetadata> columns = batchResult.getBatch().getColumns();
            for (int i = 0; i < columns.size(); i++) {
                byColumn.put(columns.get(i), batchResult.getResults().get(i));
            }
        }
        List<FieldAnalysisResult> merged = new ArrayList<>(schema.size());
        for (ColumnMetadata column : schema) {
            FieldAnalysisResult result = byColumn.get(column);
            merged.add(result != null ? result : fallback.apply(column));
        }
        return merged;
    }

    int getProcessedBatchCount() {
        return processedBatchCount.get();
    }

    int getFailedBatchCount() {
        return failedBatchCount.get();
    }

    /**
     * Shuts down the worker pool.
     */
    public void shutdown() {
        log.info("Shutting down batch processor");

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }

        log.info("Batch processor shutdown complete: {} batches processed, {} failed",
                getProcessedBatchCount(), getFailedBatchCount());
    }

    @Override
    public void destroy() {
        shutdown();
    }

    private int partsFor(int size) {
        int parts = (size + maxBatchSize - 1) / maxBatchSize;
        if (size >= largeTableThreshold) {
            parts = Math.max(parts, 2);
        }
        return Math.max(1, parts);
    }

    private BatchResult fail(ClassificationBatch batch, Function<ColumnMetadata, FieldAnalysisResult> fallback,
                             String reason) {
        failedBatchCount.incrementAndGet();
        log.warn("Batch {} marked failed ({}), using fallback results", batch.describe(), reason);
        List<FieldAnalysisResult> results = new ArrayList<>(batch.getColumns().size());
        for (ColumnMetadata column : batch.getColumns()) {
            results.add(fallback.apply(column));
        }
        return BatchResult.failure(batch, results, reason);
    }
}
