package id.my.agungdh.dnsqueryuploader.DTO;

/**
 * Hasil akhir satu batch upload. statusCode null kalau request tidak pernah dapat response
 * (timeout, connection refused, dsb).
 */
public record BatchOutcome(int batchIndex, int recordCount, boolean success, Integer statusCode, String error) {

    public static BatchOutcome sent(int batchIndex, int recordCount, int statusCode) {
        return new BatchOutcome(batchIndex, recordCount, true, statusCode, null);
    }

    public static BatchOutcome failed(int batchIndex, int recordCount, Integer statusCode, String error) {
        return new BatchOutcome(batchIndex, recordCount, false, statusCode, error);
    }
}
