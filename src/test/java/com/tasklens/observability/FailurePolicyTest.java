package com.tasklens.observability;

import com.tasklens.exception.ApiException;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class FailurePolicyTest {

    @Test
    void unmappedFailureIsServerError() {
        assertEquals(500, FailurePolicy.statusFor(new IllegalStateException("boom")));
    }

    @Test
    void responseStatusExceptionKeepsItsCode() {
        assertEquals(409, FailurePolicy.statusFor(new ResponseStatusException(HttpStatus.CONFLICT)));
    }

    @Test
    void wrappedApiExceptionKeepsItsCode() {
        ServletException wrapped = new ServletException("dispatch failed",
                ApiException.notFound("TASK_NOT_FOUND", "Task not found"));
        assertEquals(404, FailurePolicy.statusFor(wrapped));
    }

    @Test
    void clientDisconnectIsCanceled() {
        IOException brokenPipe = new IOException("Broken pipe");

        assertEquals(FailurePolicy.CLIENT_CLOSED_REQUEST, FailurePolicy.statusFor(brokenPipe));
        assertEquals(RequestOutcome.CANCELED, FailurePolicy.outcomeFor(499, brokenPipe));
        assertEquals(Level.WARN, FailurePolicy.levelFor(499, RequestOutcome.CANCELED));
    }

    @Test
    void outcomeAndLevelFollowStatusClass() {
        assertEquals(RequestOutcome.OK, FailurePolicy.outcomeFor(200, null));
        assertEquals(RequestOutcome.OK, FailurePolicy.outcomeFor(404, null));
        assertEquals(RequestOutcome.ERROR, FailurePolicy.outcomeFor(503, null));

        assertEquals(Level.INFO, FailurePolicy.levelFor(201, RequestOutcome.OK));
        assertEquals(Level.WARN, FailurePolicy.levelFor(401, RequestOutcome.OK));
        assertEquals(Level.ERROR, FailurePolicy.levelFor(500, RequestOutcome.ERROR));
    }
}
