package id.my.agungdh.dnsqueryuploader.service;

import id.my.agungdh.dnsqueryuploader.DTO.BatchOutcome;
import id.my.agungdh.dnsqueryuploader.DTO.DnsQueryRecord;
import id.my.agungdh.dnsqueryuploader.DTO.PipelineResult;
import id.my.agungdh.dnsqueryuploader.DTO.RankEntry;
import id.my.agungdh.dnsqueryuploader.client.CollectorClient;
import id.my.agungdh.dnsqueryuploader.config.CollectorProperties;
import id.my.agungdh.dnsqueryuploader.diagnostics.RecordingDiagnostics;
import id.my.agungdh.dnsqueryuploader.parser.DnsLogLineParser;
import id.my.agungdh.dnsqueryuploader.parser.DnsLogParser;
import id.my.agungdh.dnsqueryuploader.parser.LogFileAccessException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DnsQueryPipelineTest {

    @TempDir
    Path dir;

    private final CollectorClient client = mock(CollectorClient.class);
    private final RecordingDiagnostics diagnostics = new RecordingDiagnostics();
    private final List<Integer> sentBatchSizes = new CopyOnWriteArrayList<>();
    private ExecutorService executor;
    private DnsQueryPipeline pipeline;

    @BeforeEach
    void setUp() {
        CollectorProperties props = new CollectorProperties();
        props.setCollectorId("c-1");
        props.setClientKey("k-1");

        executor = Executors.newFixedThreadPool(props.getConcurrency());
        when(client.sendQueries(anyList())).thenAnswer(inv -> {
            List<DnsQueryRecord> batch = inv.getArgument(0);
            sentBatchSizes.add(batch.size());
            return ResponseEntity.ok().build();
        });

        pipeline = new DnsQueryPipeline(
                new DnsLogParser(new DnsLogLineParser(), diagnostics),
                new BatchUploader(client, executor, diagnostics),
                new QueryStatisticsService(),
                props);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static String line(String ip, String host) {
        return "13-Jan-2023 22:21:03.422633 queries: info: client @0x55adcc672300 "
                + ip + "#53307 (" + host + "): query: " + host + " IN A +E(0)DC (172.20.101.44)";
    }

    private Path write(List<String> lines) throws IOException {
        Path file = dir.resolve("queries");
        Files.write(file, lines);
        return file;
    }

    @Test
    void threeValidLinesEndToEnd() throws IOException {
        Path file = write(List.of(
                line("10.0.0.1", "a.com"),
                "garbage",
                line("10.0.0.2", "b.com"),
                line("10.0.0.1", "a.com")));

        PipelineResult result = pipeline.run(file);

        assertThat(result.getStatistics().totalRecords()).isEqualTo(3);
        List<RankEntry> ipRank = result.getStatistics().clientIpRank();
        assertThat(ipRank).extracting(RankEntry::key).containsExactly("10.0.0.1", "10.0.0.2");
        assertThat(ipRank).extracting(RankEntry::count).containsExactly(2L, 1L);
        assertThat(ipRank.get(0).percentage()).isCloseTo(66.67, within(0.005));
        assertThat(ipRank.get(1).percentage()).isCloseTo(33.33, within(0.005));
        assertThat(result.getUploads()).hasSize(1);
        assertThat(result.failedBatches()).isZero();
        assertThat(diagnostics.skippedLines).hasSize(1);
    }

    @Test
    void noParsableLinesGivesEmptyReportAndNoUpload() throws IOException {
        Path file = write(List.of("header", "", "still not a query line"));

        PipelineResult result = pipeline.run(file);

        assertThat(result.getStatistics().totalRecords()).isZero();
        assertThat(result.getStatistics().clientIpRank()).isEmpty();
        assertThat(result.getStatistics().hostRank()).isEmpty();
        assertThat(result.getUploads()).isEmpty();
        verifyNoInteractions(client);
    }

    @Test
    void twelveHundredRecordsUploadInThreeBatches() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 1200; i++) {
            lines.add(line("10.0." + (i % 7) + ".1", "host" + (i % 11) + ".com"));
        }

        PipelineResult result = pipeline.run(write(lines));

        assertThat(result.getUploads()).extracting(BatchOutcome::recordCount).containsExactly(500, 500, 200);
        assertThat(result.getUploads()).allMatch(BatchOutcome::success);
        assertThat(sentBatchSizes).containsExactlyInAnyOrder(500, 500, 200);
        assertThat(result.getStatistics().totalRecords()).isEqualTo(1200);
        assertThat(result.getStatistics().clientIpRank()).hasSize(5);
        assertThat(result.getStatistics().hostRank()).hasSize(5);
    }

    @Test
    void unreadableFileAbortsBeforeUpload() {
        assertThatThrownBy(() -> pipeline.run(dir.resolve("missing")))
                .isInstanceOf(LogFileAccessException.class);
        verifyNoInteractions(client);
    }
}
