package id.my.agungdh.dnsqueryuploader.util;

import java.util.ArrayList;
import java.util.List;

public final class BatchUtils {
    private BatchUtils() {
    }

    /**
     * Potong list jadi batch berurutan, masing-masing maksimal {@code size} elemen (batch terakhir boleh lebih kecil).
     * Input tidak diubah, tiap batch adalah salinan immutable.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) throw new IllegalArgumentException("Batch size harus > 0, dapat " + size);
        List<List<T>> batches = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            int to = Math.min(from + size, items.size());
            batches.add(List.copyOf(items.subList(from, to)));
        }
        return batches;
    }
}
