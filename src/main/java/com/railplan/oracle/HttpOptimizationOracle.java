package com.railplan.oracle;

import com.google.common.base.Strings;
import com.railplan.ScheduleException;
import com.railplan.common.JsonUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Calls an optimization service over HTTP: POST {endpoint}/optimize with the request as JSON, expecting a JSON
 * response. A bearer token or an API key is attached when configured. Any failure (connection, timeout, non-2xx
 * status, malformed body) is reported as a ScheduleException of type ORACLE_UNAVAILABLE.
 */
public class HttpOptimizationOracle implements OptimizationOracle {

    private static final Logger LOG = LoggerFactory.getLogger(HttpOptimizationOracle.class);

    /** Prefix expected on API keys. Keys configured without it have it added. */
    public static final String API_KEY_PREFIX = "rw-";

    public interface Config {
        String oracleEndpoint ();
        /** Bearer token, or empty if not used. */
        String oracleToken ();
        /** API key, or empty if not used. Ignored when a token is set. */
        String oracleApiKey ();
        int oracleTimeoutSeconds ();
    }

    private final URI optimizeUri;

    private final String token;

    private final String apiKey;

    private final Duration timeout;

    private final HttpClient httpClient;

    public HttpOptimizationOracle (Config config) {
        if (Strings.isNullOrEmpty(config.oracleEndpoint())) {
            throw ScheduleException.configuration("No optimization oracle endpoint configured.");
        }
        String base = config.oracleEndpoint();
        this.optimizeUri = URI.create(base.endsWith("/") ? base + "optimize" : base + "/optimize");
        this.token = Strings.emptyToNull(config.oracleToken());
        String key = Strings.emptyToNull(config.oracleApiKey());
        this.apiKey = key == null || key.startsWith(API_KEY_PREFIX) ? key : API_KEY_PREFIX + key;
        this.timeout = Duration.ofSeconds(config.oracleTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public OracleResponse optimize (OracleRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(optimizeUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(JsonUtilities.objectToJsonBytes(request)));
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        } else if (apiKey != null) {
            builder.header("X-API-Key", apiKey);
        }
        HttpResponse<byte[]> response;
        try {
            LOG.info("Requesting resolutions for {} conflicts from {}", request.conflicts.size(), optimizeUri);
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw ScheduleException.oracleUnavailable("Optimization oracle did not answer within " + timeout, e);
        } catch (IOException e) {
            throw ScheduleException.oracleUnavailable("Could not reach optimization oracle", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ScheduleException.oracleUnavailable("Interrupted while waiting for optimization oracle", e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw ScheduleException.oracleUnavailable("Optimization oracle responded with HTTP status "
                    + response.statusCode());
        }
        OracleResponse oracleResponse;
        try {
            oracleResponse = JsonUtilities.objectFromJsonBytes(response.body(), OracleResponse.class);
        } catch (IOException e) {
            throw ScheduleException.oracleUnavailable("Malformed response from optimization oracle", e);
        }
        if (oracleResponse == null) {
            throw ScheduleException.oracleUnavailable("Empty response from optimization oracle");
        }
        LOG.info("Oracle proposed {} resolutions in {} ms.", oracleResponse.resolutions == null ? 0 :
                oracleResponse.resolutions.size(), oracleResponse.inferenceTimeMs);
        return oracleResponse;
    }

}
