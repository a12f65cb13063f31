package com.koni.glucose.infrastructure.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration of the HTTP client used to call the Tidepool API.
 *
 * Both remote calls are blocking, so connect and read timeouts are bounded.
 */
@Slf4j
@Configuration
public class TidepoolClientConfiguration {

    @Value("${tidepool.base-url}")
    private String baseUrl;

    @Value("${tidepool.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${tidepool.read-timeout-ms:30000}")
    private int readTimeoutMs;

    /**
     * Creates the RestClient bound to the Tidepool base URL.
     */
    @Bean
    public RestClient tidepoolRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        log.info("Configured Tidepool client: baseUrl={}, connectTimeout={}ms, readTimeout={}ms",
                baseUrl, connectTimeoutMs, readTimeoutMs);

        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
