package com.fxanalytics.unit.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import com.fxanalytics.exception.CircuitOpenException;
import com.fxanalytics.exception.DomainException;
import com.fxanalytics.exception.PermanentDataException;
import com.fxanalytics.exception.TransientProviderException;
import com.fxanalytics.resilience.ErrorSummary;
import com.fxanalytics.resilience.ProviderErrors;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProviderErrorsTest {

    @Nested
    @DisplayName("Retryable classification")
    class Classification {

        @Test
        @DisplayName("Network and timeout exception types are retryable")
        void retryableTypes() {
            assertThat(ProviderErrors.isRetryable(new ConnectException("refused"))).isTrue();
            assertThat(ProviderErrors.isRetryable(new SocketTimeoutException())).isTrue();
            assertThat(ProviderErrors.isRetryable(new UnknownHostException("gateway"))).isTrue();
            assertThat(ProviderErrors.isRetryable(new TimeoutException())).isTrue();
            assertThat(ProviderErrors.isRetryable(new TransientProviderException("busy"))).isTrue();
        }

        @Test
        @DisplayName("Known transient messages are retryable whatever the type")
        void retryableMarkers() {
            assertThat(ProviderErrors.isRetryable(new IOException("connect ECONNREFUSED 127.0.0.1:8080"))).isTrue();
            assertThat(ProviderErrors.isRetryable(new RuntimeException("Service temporarily unavailable"))).isTrue();
            assertThat(ProviderErrors.isRetryable(new IOException("Connection reset by peer"))).isTrue();
        }

        @Test
        @DisplayName("The cause chain is inspected")
        void causeChain() {
            Exception wrapped = new IllegalStateException("fetch failed", new SocketTimeoutException("read"));

            assertThat(ProviderErrors.isRetryable(wrapped)).isTrue();
        }

        @Test
        @DisplayName("Data, domain and open-circuit errors are not retryable")
        void notRetryable() {
            assertThat(ProviderErrors.isRetryable(new PermanentDataException("bad ticker"))).isFalse();
            assertThat(ProviderErrors.isRetryable(new DomainException("negative spot"))).isFalse();
            assertThat(ProviderErrors.isRetryable(new CircuitOpenException("provider", 1000))).isFalse();
            assertThat(ProviderErrors.isRetryable(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("User messages")
    class UserMessages {

        @Test
        @DisplayName("Refused connections, timeouts and network errors get friendly messages")
        void friendlyMessages() {
            assertThat(ProviderErrors.userMessage(new IOException("ECONNREFUSED")))
                    .isEqualTo("Market data service is unavailable. Please try again later.");
            assertThat(ProviderErrors.userMessage(new TimeoutException("Request timeout")))
                    .isEqualTo("Request timed out. The market data service may be busy.");
            assertThat(ProviderErrors.userMessage(new IOException("NetworkError when attempting to fetch")))
                    .isEqualTo("Network error. Please check your connection.");
        }

        @Test
        @DisplayName("Other errors keep their own message")
        void passthrough() {
            assertThat(ProviderErrors.userMessage(new PermanentDataException("Unknown security: XXX")))
                    .isEqualTo("Unknown security: XXX");
            assertThat(ProviderErrors.userMessage(null)).isEqualTo("Unknown error");
        }
    }

    @Nested
    @DisplayName("Error summary")
    class Summary {

        @Test
        @DisplayName("All retryable errors read as a temporary connection issue")
        void allRetryable() {
            ErrorSummary summary = ProviderErrors.createErrorSummary(
                    List.of(new ConnectException("ECONNREFUSED"), new ConnectException("ECONNREFUSED")));

            assertThat(summary.getSummary()).isEqualTo("Temporary connection issues with market data service");
            assertThat(summary.getDetails()).containsExactly("Market data service is unavailable. Please try again later.");
            assertThat(summary.isRecoverable()).isTrue();
        }

        @Test
        @DisplayName("No retryable errors read as a data or configuration problem")
        void noneRetryable() {
            ErrorSummary summary =
                    ProviderErrors.createErrorSummary(List.of(new PermanentDataException("bad ticker")));

            assertThat(summary.getSummary()).isEqualTo("Data validation or configuration errors");
            assertThat(summary.isRecoverable()).isFalse();
        }

        @Test
        @DisplayName("A mix reads as multiple errors and is recoverable")
        void mixed() {
            ErrorSummary summary = ProviderErrors.createErrorSummary(
                    List.of(new PermanentDataException("bad ticker"), new SocketTimeoutException("read timed out")));

            assertThat(summary.getSummary()).isEqualTo("Multiple errors occurred");
            assertThat(summary.getDetails()).hasSize(2);
            assertThat(summary.isRecoverable()).isTrue();
        }
    }
}
