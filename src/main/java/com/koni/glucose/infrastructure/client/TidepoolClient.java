package com.koni.glucose.infrastructure.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.glucose.application.port.HealthDataClient;
import com.koni.glucose.domain.exception.AuthenticationException;
import com.koni.glucose.domain.exception.DataFetchException;
import com.koni.glucose.domain.exception.RemoteServiceUnavailableException;
import com.koni.glucose.domain.model.Credentials;
import com.koni.glucose.domain.model.DateRange;
import com.koni.glucose.domain.model.Session;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * Tidepool implementation of the HealthDataClient port.
 *
 * Features:
 * - Basic-auth login returning the session token (response header) and the
 *   account id (response body)
 * - Data query by account id and measurement type, with optional date bounds
 * - Circuit Breaker protection; only transport failures are recorded
 * - No retries: every failure is reported to the caller immediately
 */
@Slf4j
@Component
public class TidepoolClient implements HealthDataClient {

    public static final String SESSION_TOKEN_HEADER = "x-tidepool-session-token";

    static final String LOGIN_PATH = "/auth/login";
    static final String DATA_PATH = "/data/{accountId}?type={type}";
    static final String USER_ID_FIELD = "userid";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    public TidepoolClient(RestClient tidepoolRestClient,
                          ObjectMapper objectMapper,
                          CircuitBreaker tidepoolCircuitBreaker) {
        this.restClient = tidepoolRestClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = tidepoolCircuitBreaker;

        registerCircuitBreakerEventListeners();
    }

    @Override
    public Session login(Credentials credentials) {
        log.debug("Requesting Tidepool session: user={}", credentials.getIdentifier());

        return callRemote("login", () -> restClient.post()
                .uri(LOGIN_PATH)
                .headers(headers -> headers.setBasicAuth(
                        credentials.getIdentifier(), credentials.getSecret(), StandardCharsets.UTF_8))
                .exchange((request, response) -> readSession(response)));
    }

    @Override
    public byte[] fetchMeasurements(Session session, String type, DateRange dateRange) {
        log.info("Requesting Tidepool data: accountId={}, type={}, dateRange={}",
                session.getAccountId(), type, dateRange);

        return callRemote("data", () -> restClient.get()
                .uri(DATA_PATH + dateRange.toQuerySuffix(), session.getAccountId(), type)
                .header(SESSION_TOKEN_HEADER, session.getToken())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    if (status != HttpStatus.OK.value()) {
                        log.warn("Tidepool data call failed: accountId={}, status={} {}",
                                session.getAccountId(), status, response.getStatusText());
                        throw new DataFetchException(status, response.getStatusText());
                    }
                    byte[] body = StreamUtils.copyToByteArray(response.getBody());
                    log.debug("Tidepool data received: accountId={}, bytes={}", session.getAccountId(), body.length);
                    return body;
                }));
    }

    /**
     * Reads the session token and account id from a login response.
     * Any response that does not carry both is treated as a failed login.
     */
    private Session readSession(ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String statusText = response.getStatusText();
        if (status != HttpStatus.OK.value()) {
            log.warn("Tidepool login refused: status={} {}", status, statusText);
            throw new AuthenticationException(status, statusText);
        }

        String token = response.getHeaders().getFirst(SESSION_TOKEN_HEADER);
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Login response has no " + SESSION_TOKEN_HEADER + " header",
                    status, statusText);
        }

        byte[] body = StreamUtils.copyToByteArray(response.getBody());
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new AuthenticationException("Login response body is not JSON", status, statusText, e);
        }

        JsonNode userId = root == null ? null : root.get(USER_ID_FIELD);
        if (userId == null || userId.isNull() || !userId.isValueNode() || userId.asText().isBlank()) {
            throw new AuthenticationException("Login response has no usable " + USER_ID_FIELD + " field",
                    status, statusText);
        }

        return new Session(token, userId.asText());
    }

    /**
     * Runs a remote call through the circuit breaker and maps transport
     * failures to RemoteServiceUnavailableException.
     */
    private <T> T callRemote(String operation, Supplier<T> call) {
        Supplier<T> guarded = () -> {
            try {
                return call.get();
            } catch (ResourceAccessException e) {
                log.error("Tidepool {} call could not be completed", operation, e);
                throw new RemoteServiceUnavailableException("Tidepool is unreachable: " + e.getMessage(), e);
            }
        };

        try {
            return CircuitBreaker.decorateSupplier(circuitBreaker, guarded).get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker is OPEN, rejecting Tidepool {} call", operation);
            throw new RemoteServiceUnavailableException("Tidepool is temporarily unavailable", e);
        }
    }

    /**
     * Logs circuit breaker state transitions.
     */
    private void registerCircuitBreakerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Circuit breaker state transition: {} -> {} (failure rate: {}%)",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState(),
                        circuitBreaker.getMetrics().getFailureRate()))
                .onError(event -> log.warn("Circuit breaker recorded error: duration={}ms, error={}",
                        event.getElapsedDuration().toMillis(),
                        event.getThrowable().getClass().getSimpleName()));
    }
}
