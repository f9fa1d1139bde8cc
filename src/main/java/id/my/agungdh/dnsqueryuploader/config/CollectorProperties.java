package id.my.agungdh.dnsqueryuploader.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Setting collector tujuan upload + tuning pipeline.
 * collectorId dan clientKey wajib diisi (env COLLECTOR_ID / LUMU_CLIENT_KEY atau file .env),
 * kalau kosong context gagal start sebelum log dibaca.
 */
@Validated
@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {
    @NotBlank
    private String baseUrl = "https://api.lumu.io";
    @NotBlank
    private String collectorId;
    @NotBlank
    private String clientKey;

    @Min(1)
    private int batchSize = 500;
    @Min(1)
    private int concurrency = 5;
    @Min(0)
    private int topN = 5;

    private String logFile = "queries";
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
    private boolean runOnStartup = true;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getCollectorId() { return collectorId; }
    public void setCollectorId(String collectorId) { this.collectorId = collectorId; }

    public String getClientKey() { return clientKey; }
    public void setClientKey(String clientKey) { this.clientKey = clientKey; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public int getTopN() { return topN; }
    public void setTopN(int topN) { this.topN = topN; }

    public String getLogFile() { return logFile; }
    public void setLogFile(String logFile) { this.logFile = logFile; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public boolean isRunOnStartup() { return runOnStartup; }
    public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
}
