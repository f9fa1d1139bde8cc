package id.my.agungdh.dnsqueryuploader.diagnostics;

import id.my.agungdh.dnsqueryuploader.parser.LogLineParseException;

public record LineSkipped(long lineNumber, String line, LogLineParseException.Reason reason, String detail) {
}
