package id.my.agungdh.dnsqueryuploader.parser;

import id.my.agungdh.dnsqueryuploader.DTO.DnsQueryRecord;
import id.my.agungdh.dnsqueryuploader.diagnostics.LineSkipped;
import id.my.agungdh.dnsqueryuploader.diagnostics.PipelineDiagnostics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Baca log baris per baris. Baris yang rusak dibuang (dilaporkan ke {@link PipelineDiagnostics}),
 * urutan hasil = urutan baris di file.
 */
@Service
@RequiredArgsConstructor
public class DnsLogParser {

    private static final Logger log = LoggerFactory.getLogger(DnsLogParser.class);

    private final DnsLogLineParser lineParser;
    private final PipelineDiagnostics diagnostics;

    public List<DnsQueryRecord> parse(Path file) {
        // byte yang bukan UTF-8 valid diganti U+FFFD, baris tsb tetap diproses sendiri-sendiri
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            return parse(reader, file.toString());
        } catch (IOException e) {
            throw new LogFileAccessException(file.toString(), e);
        }
    }

    /**
     * @throws LogFileAccessException kalau pembacaan gagal di tengah jalan
     */
    public List<DnsQueryRecord> parse(Reader source, String sourceName) {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        List<DnsQueryRecord> records = new ArrayList<>();
        long lineNumber = 0;
        long skipped = 0;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                try {
                    records.add(lineParser.parse(line));
                } catch (LogLineParseException e) {
                    skipped++;
                    diagnostics.lineSkipped(new LineSkipped(lineNumber, line, e.getReason(), e.getMessage()));
                }
            }
        } catch (IOException e) {
            throw new LogFileAccessException(sourceName, e);
        }

        log.info("Parsed {}: {} lines, {} records, {} skipped", sourceName, lineNumber, records.size(), skipped);
        return records;
    }
}
