package io.perfdash.api.error;

/**
 * The requested time window is inverted or one of its bounds is not a timestamp.
 */
public class InvalidRangeException extends PerfDashException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
