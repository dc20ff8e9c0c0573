package com.nevis.vision.classify;

import com.nevis.vision.exception.BackendCallException;
import com.nevis.vision.exception.MalformedPayloadException;
import com.nevis.vision.normalize.ResponseNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failed backend call to a {@link ClassifiedError}. The status table is fixed:
 * 400 invalid input, 401/403 invalid credentials, 429 rate limited, 5xx upstream error,
 * anything else unknown. Transport timeouts and connection failures are retryable.
 */
@Component
@RequiredArgsConstructor
public class ErrorClassifier {

    private final ResponseNormalizer normalizer;

    public ClassifiedError classify(Integer httpStatus, List<String> messages, Throwable transportError) {
        if (httpStatus != null) {
            return fromStatus(httpStatus, messages);
        }
        if (transportError != null) {
            return fromTransport(transportError, messages);
        }
        return ClassifiedError.of(ErrorKind.UNKNOWN_UPSTREAM_ERROR, null, messages);
    }

    public ClassifiedError classify(Throwable failure) {
        if (failure instanceof BackendCallException callException) {
            return callException.getError();
        }
        if (failure instanceof RestClientResponseException responseException) {
            List<String> messages = normalizer.errorMessages(responseException.getResponseBodyAsString());
            return fromStatus(responseException.getStatusCode().value(), messages);
        }
        return classify(null, List.of(), failure);
    }

    public ClassifiedError fromStatus(int httpStatus, List<String> messages) {
        ErrorKind kind;
        if (httpStatus == 400) {
            kind = ErrorKind.INVALID_INPUT;
        } else if (httpStatus == 401 || httpStatus == 403) {
            kind = ErrorKind.INVALID_CREDENTIALS;
        } else if (httpStatus == 429) {
            kind = ErrorKind.RATE_LIMITED;
        } else if (httpStatus >= 500 && httpStatus <= 599) {
            kind = ErrorKind.UPSTREAM_SERVER_ERROR;
        } else {
            kind = ErrorKind.UNKNOWN_UPSTREAM_ERROR;
        }
        return ClassifiedError.of(kind, httpStatus, messages);
    }

    private ClassifiedError fromTransport(Throwable transportError, List<String> messages) {
        List<String> diagnostics = messages == null || messages.isEmpty()
            ? describe(transportError)
            : messages;

        for (Throwable current = transportError; current != null; current = next(current)) {
            if (current instanceof MalformedPayloadException) {
                return ClassifiedError.of(ErrorKind.UNKNOWN_UPSTREAM_ERROR, null, diagnostics);
            }
            if (isTimeout(current)) {
                return ClassifiedError.of(ErrorKind.TIMEOUT, null, diagnostics);
            }
            if (isConnectionFailure(current)) {
                return ClassifiedError.of(ErrorKind.NETWORK_ERROR, null, diagnostics);
            }
        }
        if (transportError instanceof ResourceAccessException) {
            return ClassifiedError.of(ErrorKind.NETWORK_ERROR, null, diagnostics);
        }
        return ClassifiedError.of(ErrorKind.UNKNOWN_UPSTREAM_ERROR, null, diagnostics);
    }

    private static boolean isTimeout(Throwable t) {
        // SocketTimeoutException is an InterruptedIOException
        return t instanceof InterruptedIOException
            || t instanceof HttpTimeoutException
            || t instanceof TimeoutException;
    }

    private static boolean isConnectionFailure(Throwable t) {
        return t instanceof ConnectException
            || t instanceof UnknownHostException
            || t instanceof NoRouteToHostException
            || t instanceof SocketException;
    }

    private static Throwable next(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }

    private static List<String> describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? List.of() : List.of(message);
    }
}
