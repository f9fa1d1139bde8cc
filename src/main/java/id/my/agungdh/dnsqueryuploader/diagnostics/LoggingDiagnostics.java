package id.my.agungdh.dnsqueryuploader.diagnostics;

import id.my.agungdh.dnsqueryuploader.DTO.BatchOutcome;
import id.my.agungdh.dnsqueryuploader.parser.LogLineParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingDiagnostics implements PipelineDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnostics.class);

    @Override
    public void lineSkipped(LineSkipped event) {
        // baris pendek (header, baris kosong) itu normal, cukup debug
        if (event.reason() == LogLineParseException.Reason.TOO_FEW_FIELDS) {
            log.debug("Skip line {}: {}", event.lineNumber(), event.detail());
        } else {
            log.warn("Skip line {}: {} -> {}", event.lineNumber(), event.detail(), event.line());
        }
    }

    @Override
    public void batchFailed(BatchOutcome outcome, Throwable cause) {
        log.warn("Batch #{} ({} records) gagal terkirim: status={} err={}",
                outcome.batchIndex(), outcome.recordCount(), outcome.statusCode(), outcome.error());
    }
}
