package id.my.agungdh.dnsqueryuploader.parser;

public class LogLineParseException extends RuntimeException {

    public enum Reason {
        TOO_FEW_FIELDS,
        INVALID_TIMESTAMP
    }

    private final Reason reason;

    public LogLineParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LogLineParseException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
