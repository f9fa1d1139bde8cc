package id.my.agungdh.dnsqueryuploader.DTO;

import java.util.List;

public record QueryStatistics(
        long totalRecords,
        List<RankEntry> clientIpRank,
        List<RankEntry> hostRank
) {
    public static QueryStatistics empty() {
        return new QueryStatistics(0, List.of(), List.of());
    }
}
