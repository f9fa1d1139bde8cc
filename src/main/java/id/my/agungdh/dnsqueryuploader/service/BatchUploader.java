package id.my.agungdh.dnsqueryuploader.service;

import id.my.agungdh.dnsqueryuploader.DTO.BatchOutcome;
import id.my.agungdh.dnsqueryuploader.DTO.DnsQueryRecord;
import id.my.agungdh.dnsqueryuploader.client.CollectorClient;
import id.my.agungdh.dnsqueryuploader.diagnostics.PipelineDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Kirim batch ke collector secara paralel, maksimal {@code concurrencyLimit} request in-flight.
 * Batch yang gagal tidak membatalkan batch lain dan tidak di-retry; hasilnya cuma dicatat.
 * {@link #upload} baru return setelah semua batch selesai (sukses atau gagal).
 */
@Service
public class BatchUploader {

    private static final Logger log = LoggerFactory.getLogger(BatchUploader.class);

    private final CollectorClient client;
    private final Executor executor;
    private final PipelineDiagnostics diagnostics;

    public BatchUploader(CollectorClient client,
                         @Qualifier("uploadExecutor") Executor executor,
                         PipelineDiagnostics diagnostics) {
        this.client = client;
        this.executor = executor;
        this.diagnostics = diagnostics;
    }

    /**
     * @return outcome per batch, urutannya sama dengan {@code batches}
     */
    public List<BatchOutcome> upload(List<List<DnsQueryRecord>> batches, int concurrencyLimit) {
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("Concurrency limit harus > 0, dapat " + concurrencyLimit);
        }
        if (batches.isEmpty()) return List.of();

        Semaphore slots = new Semaphore(concurrencyLimit);
        List<CompletableFuture<BatchOutcome>> inFlight = new ArrayList<>(batches.size());

        for (int i = 0; i < batches.size(); i++) {
            int index = i;
            List<DnsQueryRecord> batch = batches.get(i);

            try {
                slots.acquire(); // tunggu slot kosong
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                for (int j = i; j < batches.size(); j++) {
                    inFlight.add(CompletableFuture.completedFuture(
                            fail(j, batches.get(j), null, "interrupted before dispatch", ie)));
                }
                break;
            }

            CompletableFuture<BatchOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(() -> sendOne(index, batch), executor)
                        .whenComplete((outcome, ex) -> slots.release())
                        .exceptionally(ex -> fail(index, batch, null, ex.getMessage(), ex));
            } catch (RejectedExecutionException e) {
                slots.release();
                future = CompletableFuture.completedFuture(fail(index, batch, null, e.getMessage(), e));
            }
            inFlight.add(future);
        }

        // barrier: tunggu semua batch terminal
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();

        List<BatchOutcome> outcomes = inFlight.stream().map(CompletableFuture::join).toList();
        long failed = outcomes.stream().filter(o -> !o.success()).count();
        log.info("Upload selesai: {} batch, {} sukses, {} gagal", outcomes.size(), outcomes.size() - failed, failed);
        return outcomes;
    }

    private BatchOutcome sendOne(int index, List<DnsQueryRecord> batch) {
        try {
            ResponseEntity<Void> resp = client.sendQueries(batch);
            log.debug("Batch #{} ({} records) terkirim -> {}", index, batch.size(), resp.getStatusCode());
            return BatchOutcome.sent(index, batch.size(), resp.getStatusCode().value());
        } catch (RestClientResponseException e) {
            return fail(index, batch, e.getStatusCode().value(), "HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            return fail(index, batch, null, e.getMessage(), e);
        }
    }

    private BatchOutcome fail(int index, List<DnsQueryRecord> batch, Integer status, String error, Throwable cause) {
        BatchOutcome outcome = BatchOutcome.failed(index, batch.size(), status, error);
        diagnostics.batchFailed(outcome, cause);
        return outcome;
    }
}
