package com.fxanalytics.resilience;

import com.fxanalytics.exception.CircuitOpenException;
import com.fxanalytics.exception.TransientProviderException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Classifies provider failures as transient or permanent and turns them into messages a
 * user can act on.
 */
public final class ProviderErrors {

    private static final Set<Class<? extends Throwable>> RETRYABLE_TYPES = Set.of(
            TransientProviderException.class,
            ConnectException.class,
            SocketTimeoutException.class,
            UnknownHostException.class,
            NoRouteToHostException.class,
            TimeoutException.class);

    private static final List<String> RETRYABLE_MARKERS = List.of(
            "ECONNREFUSED",
            "ETIMEDOUT",
            "ENOTFOUND",
            "NetworkError",
            "Request timeout",
            "Connection reset",
            "temporarily unavailable",
            "service busy");

    static final String UNAVAILABLE_MESSAGE = "Market data service is unavailable. Please try again later.";
    static final String TIMEOUT_MESSAGE = "Request timed out. The market data service may be busy.";
    static final String NETWORK_MESSAGE = "Network error. Please check your connection.";

    private ProviderErrors() {}

    /**
     * True when the error, or anything in its cause chain, is a known transient failure.
     * An open circuit is never retryable: retrying it only burns the attempt budget.
     */
    public static boolean isRetryable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof CircuitOpenException) {
                return false;
            }
            if (isRetryableType(t) || hasRetryableMarker(t.getMessage())) {
                return true;
            }
        }
        return false;
    }

    public static String userMessage(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        if (error instanceof ConnectException || contains(message, "ECONNREFUSED")) {
            return UNAVAILABLE_MESSAGE;
        }
        if (error instanceof TimeoutException
                || error instanceof SocketTimeoutException
                || contains(message, "timeout")
                || contains(message, "timed out")) {
            return TIMEOUT_MESSAGE;
        }
        if (contains(message, "Network")) {
            return NETWORK_MESSAGE;
        }
        return message != null ? message : error.toString();
    }

    /**
     * Summarizes a set of errors by how many of them a retry could fix.
     */
    public static ErrorSummary createErrorSummary(List<? extends Throwable> errors) {
        long retryable = errors.stream().filter(ProviderErrors::isRetryable).count();

        String summary;
        if (retryable == errors.size()) {
            summary = "Temporary connection issues with market data service";
        } else if (retryable == 0) {
            summary = "Data validation or configuration errors";
        } else {
            summary = "Multiple errors occurred";
        }

        List<String> details = errors.stream()
                .map(ProviderErrors::userMessage)
                .distinct()
                .toList();

        return ErrorSummary.builder()
                .summary(summary)
                .details(details)
                .recoverable(retryable > 0)
                .build();
    }

    private static boolean isRetryableType(Throwable t) {
        return RETRYABLE_TYPES.stream().anyMatch(type -> type.isInstance(t));
    }

    private static boolean hasRetryableMarker(String message) {
        return message != null && RETRYABLE_MARKERS.stream().anyMatch(message::contains);
    }

    private static boolean contains(String message, String marker) {
        return message != null && message.contains(marker);
    }
}
