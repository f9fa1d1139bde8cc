package id.my.agungdh.dnsqueryuploader.DTO;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Satu baris query log yang sudah di-parse. Nama field JSON mengikuti format collector.
 */
@JsonPropertyOrder({"timestamp", "name", "client_ip", "client_name", "type"})
public record DnsQueryRecord(
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DnsQueryRecord.TIMESTAMP_PATTERN, timezone = "UTC")
        Instant timestamp,
        String name,
        @JsonProperty("client_ip") String clientIp,
        @JsonProperty("client_name") String clientName,
        String type
) {
    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'";
}
