package id.my.agungdh.dnsqueryuploader.parser;

import id.my.agungdh.dnsqueryuploader.DTO.DnsQueryRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parser satu baris query log (format BIND), contoh:
 * <pre>
 * 13-Jan-2023 22:21:03.422633 queries: info: client @0x55adcc672300 45.7.230.161#53307 (example.com): query: example.com IN A +E(0)DC (172.20.101.44)
 * </pre>
 * Field yang dipakai (index token): 0-1 waktu, 5 client name, 6 client ip#port, 9 host, 11 query type.
 */
@Component
public class DnsLogLineParser {

    public static final int MIN_FIELDS = 13;

    private static final int IDX_DATE = 0;
    private static final int IDX_TIME = 1;
    private static final int IDX_CLIENT_NAME = 5;
    private static final int IDX_CLIENT_ADDR = 6;
    private static final int IDX_QUERY_NAME = 9;
    private static final int IDX_QUERY_TYPE = 11;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // 13-Jan-2023 22:21:03.422633, waktu log dianggap UTC
    static final DateTimeFormatter LOG_TIMESTAMP = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-uuuu HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, true)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    public DnsQueryRecord parse(String line) {
        String[] parts = line == null ? new String[0] : WHITESPACE.splitAsStream(line)
                .filter(token -> !token.isEmpty())
                .toArray(String[]::new);
        if (parts.length < MIN_FIELDS) {
            throw new LogLineParseException(LogLineParseException.Reason.TOO_FEW_FIELDS,
                    "expected at least " + MIN_FIELDS + " fields, got " + parts.length);
        }

        Instant timestamp = parseTimestamp(parts[IDX_DATE] + " " + parts[IDX_TIME]);

        return new DnsQueryRecord(
                timestamp,
                parts[IDX_QUERY_NAME],
                stripPort(parts[IDX_CLIENT_ADDR]),
                parts[IDX_CLIENT_NAME],
                parts[IDX_QUERY_TYPE]
        );
    }

    static Instant parseTimestamp(String text) {
        try {
            return LocalDateTime.parse(text, LOG_TIMESTAMP).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new LogLineParseException(LogLineParseException.Reason.INVALID_TIMESTAMP,
                    "invalid timestamp '" + text + "'", e);
        }
    }

    /** "45.7.230.161#53307" -> "45.7.230.161" */
    static String stripPort(String address) {
        int hash = address.indexOf('#');
        return hash < 0 ? address : address.substring(0, hash);
    }
}
