package com.apisurface.signature.parser.exception;

/**
 * Malformed signature text. Aborts the whole parse; no partial codebase is returned.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final int line;
    private final String reason;

    public ParseException(String reason, String fileName, int line) {
        super(fileName + ":" + line + ": " + reason);
        this.fileName = fileName;
        this.line = line;
        this.reason = reason;
    }

    public ParseException(String reason, String fileName, int line, Throwable cause) {
        super(fileName + ":" + line + ": " + reason, cause);
        this.fileName = fileName;
        this.line = line;
        this.reason = reason;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public String getReason() {
        return reason;
    }
}
