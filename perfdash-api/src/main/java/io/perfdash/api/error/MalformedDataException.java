package io.perfdash.api.error;

/**
 * A single performance row could not be parsed.
 * <p>
 * Raised per row and recovered by the loader, which drops the row and counts it.
 */
public class MalformedDataException extends PerfDashException {

    private final String source;
    private final int lineNumber;

    public MalformedDataException(String source, int lineNumber, String reason) {
        super(source + ":" + lineNumber + ": " + reason, null, true, false);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public String source() {
        return source;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
