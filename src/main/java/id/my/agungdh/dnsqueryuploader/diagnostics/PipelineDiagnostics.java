package id.my.agungdh.dnsqueryuploader.diagnostics;

import id.my.agungdh.dnsqueryuploader.DTO.BatchOutcome;

/**
 * Sink untuk kejadian non-fatal di pipeline: baris yang dibuang parser dan batch yang gagal terkirim.
 * Dipanggil dari thread upload juga, jadi implementasi harus thread-safe.
 */
public interface PipelineDiagnostics {

    void lineSkipped(LineSkipped event);

    void batchFailed(BatchOutcome outcome, Throwable cause);
}
