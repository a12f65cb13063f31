package com.koni.glucose.application.port;

import com.koni.glucose.domain.model.Credentials;
import com.koni.glucose.domain.model.DateRange;
import com.koni.glucose.domain.model.Session;

/**
 * Port interface for the remote health-data service.
 * Implemented by infrastructure adapters (e.g. the Tidepool REST client).
 */
public interface HealthDataClient {

    /**
     * Logs in with the given credentials.
     *
     * @param credentials the user's identifier and secret
     * @return the session token and account identifier
     * @throws com.koni.glucose.domain.exception.AuthenticationException if login is refused
     *         or the response lacks a token or account identifier
     * @throws com.koni.glucose.domain.exception.RemoteServiceUnavailableException if the service
     *         cannot be reached
     */
    Session login(Credentials credentials);

    /**
     * Fetches the measurement feed of the session's account.
     * The returned body is not interpreted: it may be a measurement array or an error object.
     *
     * @param session the session obtained from {@link #login(Credentials)}
     * @param type the measurement subtype to request
     * @param dateRange optional bounds of the query
     * @return the raw response body
     * @throws com.koni.glucose.domain.exception.DataFetchException on a non-200 response
     * @throws com.koni.glucose.domain.exception.RemoteServiceUnavailableException if the service
     *         cannot be reached
     */
    byte[] fetchMeasurements(Session session, String type, DateRange dateRange);
}
