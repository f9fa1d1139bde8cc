package id.my.agungdh.dnsqueryuploader.service;

import id.my.agungdh.dnsqueryuploader.DTO.BatchOutcome;
import id.my.agungdh.dnsqueryuploader.DTO.DnsQueryRecord;
import id.my.agungdh.dnsqueryuploader.DTO.PipelineResult;
import id.my.agungdh.dnsqueryuploader.DTO.QueryStatistics;
import id.my.agungdh.dnsqueryuploader.config.CollectorProperties;
import id.my.agungdh.dnsqueryuploader.parser.DnsLogParser;
import id.my.agungdh.dnsqueryuploader.util.BatchUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * parse -> batch -> upload (paralel, ditunggu sampai selesai) -> statistik.
 * Parse harus selesai dulu sebelum upload dan agregasi jalan.
 */
@Service
@RequiredArgsConstructor
public class DnsQueryPipeline {

    private static final Logger log = LoggerFactory.getLogger(DnsQueryPipeline.class);

    private final DnsLogParser parser;
    private final BatchUploader uploader;
    private final QueryStatisticsService statisticsService;
    private final CollectorProperties props;

    public PipelineResult run(Path logFile) {
        long start = System.currentTimeMillis();

        List<DnsQueryRecord> records = parser.parse(logFile);

        List<List<DnsQueryRecord>> batches = BatchUtils.partition(records, props.getBatchSize());
        log.info("{} records -> {} batch (size {}), concurrency {}",
                records.size(), batches.size(), props.getBatchSize(), props.getConcurrency());
        List<BatchOutcome> outcomes = uploader.upload(batches, props.getConcurrency());

        QueryStatistics stats = statisticsService.aggregate(records, props.getTopN());

        return PipelineResult.builder()
                .source(logFile.toString())
                .statistics(stats)
                .uploads(outcomes)
                .durationMs(System.currentTimeMillis() - start)
                .build();
    }
}
