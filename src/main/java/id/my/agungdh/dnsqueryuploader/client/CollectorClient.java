package id.my.agungdh.dnsqueryuploader.client;

import id.my.agungdh.dnsqueryuploader.DTO.DnsQueryRecord;
import id.my.agungdh.dnsqueryuploader.config.CollectorProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Client untuk endpoint DNS queries collector:
 * POST /collectors/{collectorId}/dns/queries?key={clientKey}, body = array JSON record.
 */
@Component
public class CollectorClient {

    static final String QUERIES_PATH = "/collectors/{collectorId}/dns/queries?key={key}";

    private final RestClient http;
    private final String collectorId;
    private final String clientKey;

    public CollectorClient(@Qualifier("collectorRestClient") RestClient http, CollectorProperties props) {
        this.http = http;
        this.collectorId = props.getCollectorId();
        this.clientKey = props.getClientKey();
    }

    /**
     * Kirim satu batch. Response non-2xx dilempar sebagai
     * {@link org.springframework.web.client.RestClientResponseException}, error jaringan sebagai
     * {@link org.springframework.web.client.ResourceAccessException}.
     */
    public ResponseEntity<Void> sendQueries(List<DnsQueryRecord> batch) {
        return http.post()
                .uri(QUERIES_PATH, collectorId, clientKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(batch)
                .retrieve()
                .toBodilessEntity();
    }
}
