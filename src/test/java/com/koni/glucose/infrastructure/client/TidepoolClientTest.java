package com.koni.glucose.infrastructure.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.glucose.domain.exception.AuthenticationException;
import com.koni.glucose.domain.exception.DataFetchException;
import com.koni.glucose.domain.exception.RemoteServiceUnavailableException;
import com.koni.glucose.domain.model.Credentials;
import com.koni.glucose.domain.model.DateRange;
import com.koni.glucose.domain.model.Session;
import com.koni.glucose.infrastructure.resilience.CircuitBreakerConfiguration;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests for TidepoolClient against a mocked Tidepool API.
 * Tests login, data retrieval, HTTP failures, transport failures and the circuit breaker.
 */
class TidepoolClientTest {

    private static final String BASE_URL = "https://tidepool.test";

    private MockRestServiceServer server;
    private CircuitBreaker circuitBreaker;
    private TidepoolClient client;

    private final Credentials credentials = new Credentials("user@example.com", "secret");

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        circuitBreaker = CircuitBreaker.of(CircuitBreakerConfiguration.TIDEPOOL,
                new CircuitBreakerConfiguration().tidepoolCircuitBreakerConfig());
        client = new TidepoolClient(builder.build(), new ObjectMapper(), circuitBreaker);
    }

    @Test
    void shouldLoginWithBasicAuthAndReturnSession() {
        // Given
        String expectedAuth = "Basic " + Base64.getEncoder()
                .encodeToString("user@example.com:secret".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(BASE_URL + "/auth/login"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, expectedAuth))
                .andRespond(withSuccess("{\"emailVerified\":true,\"userid\":\"abc123\",\"username\":\"user@example.com\"}",
                        MediaType.APPLICATION_JSON)
                        .header(TidepoolClient.SESSION_TOKEN_HEADER, "token-xyz"));

        // When
        Session session = client.login(credentials);

        // Then
        server.verify();
        assertThat(session.getToken()).isEqualTo("token-xyz");
        assertThat(session.getAccountId()).isEqualTo("abc123");
    }

    @Test
    void shouldFailLoginOnNonOkStatus() {
        // Given
        server.expect(requestTo(BASE_URL + "/auth/login"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        // When / Then
        assertThatThrownBy(() -> client.login(credentials))
                .isInstanceOfSatisfying(AuthenticationException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(401));
    }

    @Test
    void shouldFailLoginWithoutSessionToken() {
        // Given
        server.expect(requestTo(BASE_URL + "/auth/login"))
                .andRespond(withSuccess("{\"userid\":\"abc123\"}", MediaType.APPLICATION_JSON));

        // When / Then
        assertThatThrownBy(() -> client.login(credentials))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining(TidepoolClient.SESSION_TOKEN_HEADER);
    }

    @Test
    void shouldFailLoginWithoutUserId() {
        // Given
        server.expect(requestTo(BASE_URL + "/auth/login"))
                .andRespond(withSuccess("{\"username\":\"user@example.com\"}", MediaType.APPLICATION_JSON)
                        .header(TidepoolClient.SESSION_TOKEN_HEADER, "token-xyz"));

        // When / Then
        assertThatThrownBy(() -> client.login(credentials))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("userid");
    }

    @Test
    void shouldFailLoginWhenBodyIsNotJson() {
        // Given
        server.expect(requestTo(BASE_URL + "/auth/login"))
                .andRespond(withSuccess("<html>ok</html>", MediaType.TEXT_HTML)
                        .header(TidepoolClient.SESSION_TOKEN_HEADER, "token-xyz"));

        // When / Then
        assertThatThrownBy(() -> client.login(credentials))
                .isInstanceOf(AuthenticationException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldFetchMeasurementsWithTokenAndDateBounds() {
        // Given
        Session session = new Session("token-xyz", "abc123");
        DateRange range = DateRange.of(LocalDate.of(2021, 3, 1), LocalDate.of(2021, 3, 31));
        String body = "[{\"type\":\"smbg\",\"value\":5.5}]";
        server.expect(requestTo(BASE_URL + "/data/abc123?type=smbg"
                        + "&startDate=2021-03-01T01:00:00.000Z&endDate=2021-03-31T01:00:00.000Z"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(TidepoolClient.SESSION_TOKEN_HEADER, "token-xyz"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // When
        byte[] result = client.fetchMeasurements(session, "smbg", range);

        // Then
        server.verify();
        assertThat(new String(result, StandardCharsets.UTF_8)).isEqualTo(body);
    }

    @Test
    void shouldFetchWithoutDateParametersForUnboundedRange() {
        // Given
        Session session = new Session("token-xyz", "abc123");
        server.expect(requestTo(BASE_URL + "/data/abc123?type=smbg"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        // When
        byte[] result = client.fetchMeasurements(session, "smbg", DateRange.unbounded());

        // Then
        server.verify();
        assertThat(result).isEqualTo("[]".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldReturnErrorObjectBodyUnchangedWhenStatusIsOk() {
        // Given
        Session session = new Session("token-xyz", "abc123");
        String body = "{\"code\":\"unauthorized\",\"message\":\"Invalid credentials\",\"status\":401}";
        server.expect(requestTo(BASE_URL + "/data/abc123?type=smbg"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // When
        byte[] result = client.fetchMeasurements(session, "smbg", DateRange.unbounded());

        // Then
        assertThat(new String(result, StandardCharsets.UTF_8)).isEqualTo(body);
    }

    @Test
    void shouldFailFetchOnNonOkStatus() {
        // Given
        Session session = new Session("token-xyz", "abc123");
        server.expect(requestTo(BASE_URL + "/data/abc123?type=smbg"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        // When / Then
        assertThatThrownBy(() -> client.fetchMeasurements(session, "smbg", DateRange.unbounded()))
                .isInstanceOfSatisfying(DataFetchException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(403));
    }

    @Test
    void shouldMapTransportFailureToServiceUnavailable() {
        // Given
        server.expect(requestTo(BASE_URL + "/auth/login"))
                .andRespond(withException(new ConnectException("Connection refused")));

        // When / Then
        assertThatThrownBy(() -> client.login(credentials))
                .isInstanceOf(RemoteServiceUnavailableException.class)
                .hasMessageContaining("unreachable");
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isEqualTo(1);
    }

    @Test
    void shouldNotCountRejectedLoginAsCircuitBreakerFailure() {
        // Given
        server.expect(requestTo(BASE_URL + "/auth/login"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        // When
        assertThatThrownBy(() -> client.login(credentials)).isInstanceOf(AuthenticationException.class);

        // Then
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isZero();
    }

    @Test
    void shouldFailFastWhenCircuitIsOpen() {
        // Given
        circuitBreaker.transitionToOpenState();

        // When / Then
        assertThatThrownBy(() -> client.login(credentials))
                .isInstanceOf(RemoteServiceUnavailableException.class)
                .hasMessage("Tidepool is temporarily unavailable");
        server.verify();
    }
}
