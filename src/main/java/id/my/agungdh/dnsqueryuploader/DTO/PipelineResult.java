package id.my.agungdh.dnsqueryuploader.DTO;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineResult {
    String source;
    QueryStatistics statistics;
    List<BatchOutcome> uploads;
    long durationMs;

    public long failedBatches() {
        return uploads.stream().filter(o -> !o.success()).count();
    }
}
