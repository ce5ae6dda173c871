package com.anatomie.orchestrator.client;

import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;

/**
 * Thrown when a collaborator service returns an error or is unreachable.
 *
 * Unchecked: coordinators catch it at stage boundaries and turn it into a
 * failed stage; everything else lets it propagate.
 */
public class ServiceException extends RuntimeException {

    /**
     * TRANSIENT    – connection error, timeout, 429 or 5xx; worth retrying.
     * COLLABORATOR – any other non-2xx answer; retrying won't help.
     * PARSE        – the body could not be read as the expected JSON.
     */
    public enum Kind { TRANSIENT, COLLABORATOR, PARSE }

    private final Kind kind;
    private final int  statusCode;

    public ServiceException(Kind kind, String message) {
        this(kind, message, -1, null);
    }

    public ServiceException(Kind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public ServiceException(Kind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind()       { return kind; }

    /** HTTP status of the failed call, or -1 when no response arrived. */
    public int  getStatusCode() { return statusCode; }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT;
    }

    /**
     * True when the collaborator cannot have acted on the request: the
     * connection was never made, or it answered 429 or 503. A read timeout
     * or another 5xx does not qualify; the work may have been done.
     */
    public boolean isSafeToRepeat() {
        if (statusCode == 429 || statusCode == 503) {
            return true;
        }
        Throwable cause = getCause();
        return cause instanceof ConnectException || cause instanceof HttpConnectTimeoutException;
    }

    /** Map an HTTP status to the matching kind. */
    public static Kind kindForStatus(int status) {
        return (status == 429 || status >= 500) ? Kind.TRANSIENT : Kind.COLLABORATOR;
    }
}
