package com.tasklens.observability;

import com.tasklens.exception.ApiException;
import org.slf4j.event.Level;
import org.springframework.web.ErrorResponse;
import org.springframework.web.util.DisconnectedClientHelper;

/**
 * Maps request failures to status codes, outcomes and log levels.
 */
public final class FailurePolicy {

    /** Non-standard status used for requests the client abandoned before a response was sent. */
    public static final int CLIENT_CLOSED_REQUEST = 499;

    private FailurePolicy() {
    }

    /**
     * Status for a failure that escaped the handler chain. Specific failures carry their own
     * code; anything unmapped becomes 500.
     */
    public static int statusFor(Throwable failure) {
        if (isClientDisconnect(failure)) {
            return CLIENT_CLOSED_REQUEST;
        }
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ApiException api) {
                return api.getStatus().value();
            }
            if (t instanceof ErrorResponse response) {
                return response.getStatusCode().value();
            }
        }
        return 500;
    }

    public static RequestOutcome outcomeFor(int status, Throwable failure) {
        if (failure != null && isClientDisconnect(failure)) {
            return RequestOutcome.CANCELED;
        }
        return status >= 500 ? RequestOutcome.ERROR : RequestOutcome.OK;
    }

    /**
     * Client errors are expected and logged at WARN; server errors at ERROR.
     */
    public static Level levelFor(int status, RequestOutcome outcome) {
        if (outcome == RequestOutcome.CANCELED) return Level.WARN;
        if (status >= 500) return Level.ERROR;
        if (status >= 400) return Level.WARN;
        return Level.INFO;
    }

    public static boolean isClientDisconnect(Throwable failure) {
        return DisconnectedClientHelper.isClientDisconnectedException(failure);
    }
}
