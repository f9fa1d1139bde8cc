package id.my.agungdh.dnsqueryuploader.DTO;

public record RankEntry(String key, long count, double percentage) {
}
