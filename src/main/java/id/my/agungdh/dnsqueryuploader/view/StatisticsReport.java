package id.my.agungdh.dnsqueryuploader.view;

import id.my.agungdh.dnsqueryuploader.DTO.QueryStatistics;
import id.my.agungdh.dnsqueryuploader.DTO.RankEntry;

import java.util.List;
import java.util.Locale;

/**
 * Render statistik jadi tabel teks untuk console.
 */
public final class StatisticsReport {
    private StatisticsReport() {
    }

    private static final String RULE = "-".repeat(40);

    public static String render(QueryStatistics stats) {
        StringBuilder sb = new StringBuilder();
        sb.append("Total Records: ").append(stats.totalRecords()).append("\n\n");

        sb.append("Client IPs Rank\n").append(RULE).append('\n');
        table(sb, "Client IP", 20, stats.clientIpRank());

        sb.append("\nHost Rank\n").append(RULE).append('\n');
        table(sb, "Host", 30, stats.hostRank());
        return sb.toString();
    }

    private static void table(StringBuilder sb, String keyHeader, int keyWidth, List<RankEntry> rows) {
        String rowFmt = "%-" + keyWidth + "s %-10s %s\n";
        sb.append(String.format(Locale.ROOT, rowFmt, keyHeader, "Count", "Percentage"));
        for (RankEntry e : rows) {
            sb.append(String.format(Locale.ROOT, rowFmt, e.key(), e.count(),
                    String.format(Locale.ROOT, "%.2f%%", e.percentage())));
        }
    }
}
