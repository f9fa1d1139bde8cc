package id.my.agungdh.dnsqueryuploader.parser;

import java.io.IOException;

/**
 * Sumber log tidak bisa dibuka/dibaca. Fatal untuk satu run, tidak ada hasil parsial.
 */
public class LogFileAccessException extends RuntimeException {

    private final String source;

    public LogFileAccessException(String source, IOException cause) {
        super("Gagal membaca log " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
