package io.perfdash.api.error;

/**
 * Base type for every failure raised while reading artifacts or answering queries.
 * <p>
 * None of these are fatal to the process: a bad device folder never prevents
 * listing or querying the others.
 */
public class PerfDashException extends RuntimeException {

    public PerfDashException(String message) {
        super(message);
    }

    public PerfDashException(String message, Throwable cause) {
        super(message, cause);
    }

    protected PerfDashException(String message, Throwable cause,
                                boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
