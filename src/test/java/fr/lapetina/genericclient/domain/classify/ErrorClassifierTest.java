package fr.lapetina.genericclient.domain.classify;

import fr.lapetina.genericclient.domain.exception.ConfigurationException;
import fr.lapetina.genericclient.domain.exception.ResolutionException;
import fr.lapetina.genericclient.domain.exception.TransportException;
import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.domain.retry.RetrySignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorClassifierTest {

    @Nested
    @DisplayName("Status patterns")
    class StatusPatternTests {

        @Test
        @DisplayName("should match exact code")
        void shouldMatchExactCode() {
            Set<String> patterns = StatusPatterns.normalize(List.of("503"));

            assertThat(StatusPatterns.matches(patterns, 503)).isTrue();
            assertThat(StatusPatterns.matches(patterns, 502)).isFalse();
        }

        @Test
        @DisplayName("should match two-digit family")
        void shouldMatchTwoDigitFamily() {
            Set<String> patterns = StatusPatterns.normalize(List.of("50x"));

            assertThat(StatusPatterns.matches(patterns, 500)).isTrue();
            assertThat(StatusPatterns.matches(patterns, 509)).isTrue();
            assertThat(StatusPatterns.matches(patterns, 510)).isFalse();
        }

        @Test
        @DisplayName("should match one-digit family")
        void shouldMatchOneDigitFamily() {
            Set<String> patterns = StatusPatterns.normalize(List.of("5xx"));

            assertThat(StatusPatterns.matches(patterns, 500)).isTrue();
            assertThat(StatusPatterns.matches(patterns, 599)).isTrue();
            assertThat(StatusPatterns.matches(patterns, 499)).isFalse();
        }

        @Test
        @DisplayName("should accept numbers and upper case")
        void shouldNormalizeNumbersAndCase() {
            Set<String> patterns = StatusPatterns.normalize(List.of(429, "50X", " 5xx "));

            assertThat(patterns).containsExactly("429", "50x", "5xx");
        }

        @Test
        @DisplayName("should reject unrecognized patterns")
        void shouldRejectUnrecognizedPatterns() {
            assertThatThrownBy(() -> StatusPatterns.normalize(List.of("5x3")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("5x3");
            assertThatThrownBy(() -> StatusPatterns.normalize(List.of("600")))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> StatusPatterns.normalize(List.of("server-error")))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Responses")
    class ResponseTests {

        private final ErrorClassifier classifier = new ErrorClassifier(Set.of("503", "42x"), Set.of());

        @Test
        @DisplayName("should signal retriable status with the response")
        void shouldSignalRetriableStatus() {
            Optional<RetrySignal<String>> signal = classifier.classify("busy", 503);

            assertThat(signal).isPresent();
            assertThat(signal.get().isError()).isFalse();
            assertThat(signal.get().getValue()).contains("busy");
        }

        @Test
        @DisplayName("should not signal success or unlisted status")
        void shouldNotSignalOtherStatuses() {
            assertThat(classifier.classify("ok", 200)).isEmpty();
            assertThat(classifier.classify("gone", 500)).isEmpty();
            assertThat(classifier.classify("not found", 404)).isEmpty();
        }

        @Test
        @DisplayName("should retry family members")
        void shouldRetryFamilyMembers() {
            assertThat(classifier.isRetriable(429)).isTrue();
            assertThat(classifier.isRetriable(420)).isTrue();
            assertThat(classifier.isRetriable(430)).isFalse();
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("should retry configured error kinds")
        void shouldRetryConfiguredKinds() {
            ErrorClassifier classifier = new ErrorClassifier(Set.of(), Set.of(ErrorKind.CONNECTION));

            TransportException refused = TransportException.wrap("GET", "http://a", new ConnectException("refused"));
            TransportException timedOut = TransportException.wrap("GET", "http://a", new HttpTimeoutException("slow"));

            assertThat(classifier.isRetriable(refused)).isTrue();
            assertThat(classifier.isRetriable(timedOut)).isFalse();
        }

        @Test
        @DisplayName("should not retry errors by default")
        void shouldNotRetryByDefault() {
            ErrorClassifier classifier = new ErrorClassifier(Set.of("5xx"), Set.of());

            assertThat(classifier.isRetriable(new ConnectException("refused"))).isFalse();
            assertThat(classifier.isRetriable(new ResolutionException("svc", "dev", "Unknown service"))).isFalse();
        }

        @Test
        @DisplayName("should unwrap completion exceptions")
        void shouldUnwrapCompletionExceptions() {
            ErrorClassifier classifier = new ErrorClassifier(Set.of(), Set.of(ErrorKind.TIMEOUT));
            HttpTimeoutException timeout = new HttpTimeoutException("slow");

            Optional<RetrySignal<String>> signal = classifier.classify(new CompletionException(timeout));

            assertThat(signal).isPresent();
            assertThat(signal.get().getError()).containsSame(timeout);
        }

        @Test
        @DisplayName("should retry configured exception types")
        void shouldRetryExceptionTypes() {
            ErrorClassifier classifier = new ErrorClassifier(
                    Set.of(), Set.of(), List.of(IllegalStateException.class));

            assertThat(classifier.isRetriable(new IllegalStateException("flaky"))).isTrue();
            assertThat(classifier.isRetriable(new IllegalArgumentException("bad"))).isFalse();
        }
    }
}
