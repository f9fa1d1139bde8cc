package id.my.agungdh.dnsqueryuploader.bootstrap;

import id.my.agungdh.dnsqueryuploader.DTO.PipelineResult;
import id.my.agungdh.dnsqueryuploader.config.CollectorProperties;
import id.my.agungdh.dnsqueryuploader.service.DnsQueryPipeline;
import id.my.agungdh.dnsqueryuploader.view.StatisticsReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Jalan sekali saat startup: path log dari argumen pertama, kalau tidak ada pakai collector.log-file.
 */
@Component
@ConditionalOnProperty(prefix = "collector", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final DnsQueryPipeline pipeline;
    private final CollectorProperties props;
    private final PrintStream out;

    @Autowired
    public PipelineRunner(DnsQueryPipeline pipeline, CollectorProperties props) {
        this(pipeline, props, System.out);
    }

    PipelineRunner(DnsQueryPipeline pipeline, CollectorProperties props, PrintStream out) {
        this.pipeline = pipeline;
        this.props = props;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path logFile = resolveLogFile(args.getNonOptionArgs());
        log.info("Memproses DNS query log {}", logFile.toAbsolutePath());

        PipelineResult result = pipeline.run(logFile);
        log.info("Selesai dalam {} ms: {} records, {} batch gagal dari {}",
                result.getDurationMs(), result.getStatistics().totalRecords(),
                result.failedBatches(), result.getUploads().size());

        out.print(StatisticsReport.render(result.getStatistics()));
        out.flush();
    }

    Path resolveLogFile(List<String> nonOptionArgs) {
        if (nonOptionArgs != null && !nonOptionArgs.isEmpty() && !nonOptionArgs.get(0).isBlank()) {
            return Path.of(nonOptionArgs.get(0));
        }
        return Path.of(props.getLogFile());
    }
}
