package com.geo.match.geocode;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Geocoding provider backed by the Google Maps Geocoding API.
 *
 * <p>Sends {@code GET <baseUrl>?address=...&key=...} and reads
 * {@code results[0].geometry.location.{lat,lng}} and {@code results[0].formatted_address}.
 * A response without results whose {@code status} is {@code OVER_QUERY_LIMIT} or
 * {@code OVER_DAILY_LIMIT} is reported as {@link GeocodeStatus#QUOTA_EXCEEDED}.</p>
 *
 * Usage:
 * <pre>
 * GoogleGeocodingProvider provider = GoogleGeocodingProvider.builder()
 *     .apiKey(System.getenv("API_KEY"))
 *     .timeout(Duration.ofSeconds(20))
 *     .build();
 * </pre>
 */
public class GoogleGeocodingProvider implements GeocodingProvider {
    private static final Logger log = LoggerFactory.getLogger(GoogleGeocodingProvider.class);

    private static final String DEFAULT_BASE_URL = "https://maps.googleapis.com/maps/api/geocode/json";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final Set<String> QUOTA_STATUSES = Set.of("OVER_QUERY_LIMIT", "OVER_DAILY_LIMIT");
    private static final Set<String> NOT_FOUND_STATUSES = Set.of("OK", "ZERO_RESULTS");

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private GoogleGeocodingProvider(Builder builder) {
        if (builder.apiKey == null || builder.apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.apiKey = builder.apiKey;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public GeocodeResult geocode(String address) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(requestUri(address))
                    .timeout(timeout)
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("geocode.httpStatus status={} address='{}'", response.statusCode(), address);
            }
            return parseResponse(response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GeocodeResult.failed("Interrupted");
        } catch (IOException | IllegalArgumentException e) {
            log.debug("geocode.requestFailed address='{}' error={}", address, e.getMessage());
            return GeocodeResult.failed("Request failed: " + e.getMessage());
        }
    }

    @Override
    public String getProviderName() {
        return "Google";
    }

    URI requestUri(String address) {
        return URI.create(baseUrl
                + "?address=" + URLEncoder.encode(address, StandardCharsets.UTF_8)
                + "&key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
    }

    /**
     * Maps a response body to a result.
     */
    GeocodeResult parseResponse(String body) {
        GeocodeResponse response;
        try {
            response = objectMapper.readValue(body, GeocodeResponse.class);
        } catch (JsonProcessingException e) {
            log.debug("geocode.malformedResponse error={}", e.getOriginalMessage());
            return GeocodeResult.failed("Malformed response: " + e.getOriginalMessage());
        }
        if (response == null) {
            return GeocodeResult.failed("Empty response");
        }

        Location location = firstLocation(response);
        if (location != null && location.lat() != null && location.lng() != null) {
            String formatted = response.results().get(0).formattedAddress();
            return GeocodeResult.resolved(location.lat(), location.lng(), formatted);
        }

        String status = response.status() != null ? response.status() : "";
        if (QUOTA_STATUSES.contains(status)) {
            return GeocodeResult.quotaExceeded(response.errorMessage() != null ? response.errorMessage() : status);
        }
        if (NOT_FOUND_STATUSES.contains(status)) {
            return GeocodeResult.notFound();
        }
        String detail = response.errorMessage() != null ? status + ": " + response.errorMessage() : status;
        return GeocodeResult.failed(detail.isEmpty() ? "No results" : detail);
    }

    private static Location firstLocation(GeocodeResponse response) {
        if (response.results() == null || response.results().isEmpty()) {
            return null;
        }
        Result first = response.results().get(0);
        if (first == null || first.geometry() == null) {
            return null;
        }
        return first.geometry().location();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public GoogleGeocodingProvider build() {
            return new GoogleGeocodingProvider(this);
        }
    }

    // Response DTOs for the geocoding API
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeocodeResponse(
            List<Result> results,
            String status,
            @JsonProperty("error_message") String errorMessage
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Result(
            @JsonProperty("formatted_address") String formattedAddress,
            Geometry geometry
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Geometry(Location location) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Location(Double lat, Double lng) {}
}
