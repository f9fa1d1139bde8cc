package id.my.agungdh.dnsqueryuploader.service;

import id.my.agungdh.dnsqueryuploader.DTO.DnsQueryRecord;
import id.my.agungdh.dnsqueryuploader.DTO.QueryStatistics;
import id.my.agungdh.dnsqueryuploader.DTO.RankEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Total record + top-N client IP dan top-N host yang di-query.
 * Urutan: count menurun, kalau sama yang muncul duluan menang.
 */
@Service
public class QueryStatisticsService {

    public static final int DEFAULT_TOP_N = 5;

    public QueryStatistics aggregate(List<DnsQueryRecord> records) {
        return aggregate(records, DEFAULT_TOP_N);
    }

    public QueryStatistics aggregate(List<DnsQueryRecord> records, int topN) {
        if (topN < 0) throw new IllegalArgumentException("topN tidak boleh negatif: " + topN);

        long total = records.size();
        // tanpa record tidak ada persentase (hindari bagi nol)
        if (total == 0) return QueryStatistics.empty();

        return new QueryStatistics(
                total,
                rank(records, DnsQueryRecord::clientIp, topN, total),
                rank(records, DnsQueryRecord::name, topN, total)
        );
    }

    static List<RankEntry> rank(List<DnsQueryRecord> records,
                                Function<DnsQueryRecord, String> key,
                                int topN,
                                long total) {
        // LinkedHashMap: urutan pertama kali muncul dipakai sebagai tie-breaker
        Map<String, Long> counts = new LinkedHashMap<>();
        for (DnsQueryRecord r : records) {
            counts.merge(key.apply(r), 1L, Long::sum);
        }

        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())); // stable

        return entries.stream()
                .limit(topN)
                .map(e -> new RankEntry(e.getKey(), e.getValue(), e.getValue() * 100.0 / total))
                .toList();
    }
}
