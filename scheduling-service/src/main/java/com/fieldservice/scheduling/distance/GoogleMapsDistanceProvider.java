package com.fieldservice.scheduling.distance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldservice.shared.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Distance and travel time from the Google Maps Distance Matrix API.
 *
 * Flow:
 *  1. Validate coordinates (IllegalArgumentException on out-of-range values)
 *  2. GET /maps/api/distancematrix/json?units=imperial&mode=driving, up to 3 attempts
 *     with exponential backoff (100ms, 200ms)
 *  3. Convert meters → miles and seconds → minutes (rounded up)
 *  4. Single-pair lookups fall back to haversine × 1.3 (approximate road distance)
 *     and a 30 mph travel estimate when the API fails or returns a non-OK element
 *
 * An interrupted caller gets the failure rethrown instead of a fallback value.
 */
@Slf4j
public class GoogleMapsDistanceProvider implements DistanceProvider {

    static final String DISTANCE_MATRIX_PATH = "/maps/api/distancematrix/json";
    static final int MAX_ATTEMPTS = 3;

    private static final BigDecimal METERS_TO_MILES = new BigDecimal("0.000621371");
    private static final double HAVERSINE_ROAD_FACTOR = 1.3;
    private static final double FALLBACK_SPEED_MPH = 30.0;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Duration initialBackoff;

    public GoogleMapsDistanceProvider(RestClient restClient, ObjectMapper objectMapper, String apiKey) {
        this(restClient, objectMapper, apiKey, Duration.ofMillis(100));
    }

    GoogleMapsDistanceProvider(RestClient restClient, ObjectMapper objectMapper, String apiKey, Duration initialBackoff) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Google Maps API key is not configured; distance lookups will use the haversine fallback");
        }
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.initialBackoff = initialBackoff;
    }

    @Override
    public BigDecimal getDistance(double originLat, double originLng, double destLat, double destLng) {
        GeoUtil.validateCoordinates(originLat, originLng);
        GeoUtil.validateCoordinates(destLat, destLng);

        try {
            DistanceResult result = singlePair(originLat, originLng, destLat, destLng);
            return result.getDistanceMiles() != null
                    ? result.getDistanceMiles()
                    : haversineRoadMiles(originLat, originLng, destLat, destLng);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.error("Error getting distance from ({},{}) to ({},{}), using haversine fallback",
                    originLat, originLng, destLat, destLng, e);
            return haversineRoadMiles(originLat, originLng, destLat, destLng);
        }
    }

    @Override
    public int getTravelTime(double originLat, double originLng, double destLat, double destLng) {
        GeoUtil.validateCoordinates(originLat, originLng);
        GeoUtil.validateCoordinates(destLat, destLng);

        try {
            DistanceResult result = singlePair(originLat, originLng, destLat, destLng);
            if (result.getTravelTimeMinutes() != null) {
                return result.getTravelTimeMinutes();
            }
            return estimateTravelMinutes(result.getDistanceMiles() != null
                    ? result.getDistanceMiles()
                    : haversineRoadMiles(originLat, originLng, destLat, destLng));
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.error("Error getting travel time from ({},{}) to ({},{}), estimating at {} mph",
                    originLat, originLng, destLat, destLng, FALLBACK_SPEED_MPH, e);
            return estimateTravelMinutes(haversineRoadMiles(originLat, originLng, destLat, destLng));
        }
    }

    @Override
    public List<List<DistanceResult>> getDistanceBatch(List<Coordinates> origins, List<Coordinates> destinations) {
        if (origins == null || origins.isEmpty()) {
            throw new IllegalArgumentException("Origins cannot be null or empty");
        }
        if (destinations == null || destinations.isEmpty()) {
            throw new IllegalArgumentException("Destinations cannot be null or empty");
        }
        origins.forEach(c -> GeoUtil.validateCoordinates(c.latitude(), c.longitude()));
        destinations.forEach(c -> GeoUtil.validateCoordinates(c.latitude(), c.longitude()));

        String body = callApiWithRetry(format(origins), format(destinations));
        return parseResponse(body, origins.size(), destinations.size());
    }

    String callApiWithRetry(String origins, String destinations) {
        long delayMs = initialBackoff.toMillis();
        RestClientException lastFailure = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                String body = restClient.get()
                        .uri(uri -> uri.path(DISTANCE_MATRIX_PATH)
                                .queryParam("origins", origins)
                                .queryParam("destinations", destinations)
                                .queryParam("units", "imperial")
                                .queryParam("mode", "driving")
                                .queryParam("key", apiKey)
                                .build())
                        .retrieve()
                        .body(String.class);
                if (body == null) {
                    throw new DistanceProviderException("Empty response from Google Maps Distance Matrix API");
                }
                return body;
            } catch (RestClientException e) {
                lastFailure = e;
                log.warn("Google Maps API request failed, attempt {}/{}: {}", attempt, MAX_ATTEMPTS, e.getMessage());
                if (attempt < MAX_ATTEMPTS) {
                    sleep(delayMs);
                    delayMs *= 2;
                }
            }
        }
        throw new DistanceProviderException(
                "Google Maps API unreachable after " + MAX_ATTEMPTS + " attempts", lastFailure);
    }

    List<List<DistanceResult>> parseResponse(String body, int originCount, int destinationCount) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DistanceProviderException("Failed to parse Google Maps response", e);
        }

        String status = root.path("status").asText("UNKNOWN");
        if (!DistanceResult.STATUS_OK.equals(status)) {
            String message = root.path("error_message").asText("API request failed");
            log.error("Google Maps API error: status={} message={}", status, message);
            return errorMatrix(originCount, destinationCount, status, message);
        }

        JsonNode rows = root.path("rows");
        if (rows.size() != originCount) {
            log.warn("Response row count {} doesn't match origin count {}", rows.size(), originCount);
        }

        List<List<DistanceResult>> matrix = new ArrayList<>();
        for (JsonNode row : rows) {
            List<DistanceResult> results = new ArrayList<>();
            for (JsonNode element : row.path("elements")) {
                results.add(parseElement(element));
            }
            matrix.add(results);
        }
        return matrix;
    }

    private DistanceResult parseElement(JsonNode element) {
        String status = element.path("status").asText("UNKNOWN");
        DistanceResult result = DistanceResult.builder().status(status).build();

        JsonNode meters = element.path("distance").path("value");
        JsonNode seconds = element.path("duration").path("value");

        if (DistanceResult.STATUS_OK.equals(status) && meters.isNumber() && seconds.isNumber()) {
            result.setDistanceMiles(meters.decimalValue().multiply(METERS_TO_MILES));
            result.setTravelTimeMinutes((int) Math.ceil(seconds.asDouble() / 60.0));
        } else if (!DistanceResult.STATUS_OK.equals(status)) {
            result.setErrorMessage("Status: " + status);
            log.warn("Distance calculation failed with status {}", status);
        }
        return result;
    }

    private DistanceResult singlePair(double originLat, double originLng, double destLat, double destLng) {
        List<List<DistanceResult>> matrix = getDistanceBatch(
                List.of(new Coordinates(originLat, originLng)),
                List.of(new Coordinates(destLat, destLng)));
        if (matrix.isEmpty() || matrix.get(0).isEmpty()) {
            throw new DistanceProviderException("Google Maps returned an empty distance matrix");
        }
        return matrix.get(0).get(0);
    }

    static BigDecimal haversineRoadMiles(double originLat, double originLng, double destLat, double destLng) {
        return BigDecimal.valueOf(GeoUtil.distanceMiles(originLat, originLng, destLat, destLng) * HAVERSINE_ROAD_FACTOR);
    }

    static int estimateTravelMinutes(BigDecimal distanceMiles) {
        return (int) Math.ceil(distanceMiles.doubleValue() / FALLBACK_SPEED_MPH * 60.0);
    }

    private static List<List<DistanceResult>> errorMatrix(int originCount, int destinationCount,
                                                         String status, String message) {
        List<List<DistanceResult>> matrix = new ArrayList<>();
        for (int i = 0; i < originCount; i++) {
            List<DistanceResult> row = new ArrayList<>();
            for (int j = 0; j < destinationCount; j++) {
                row.add(DistanceResult.builder().status(status).errorMessage(message).build());
            }
            matrix.add(row);
        }
        return matrix;
    }

    private static String format(List<Coordinates> coordinates) {
        return coordinates.stream()
                .map(c -> c.latitude() + "," + c.longitude())
                .collect(Collectors.joining("|"));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DistanceProviderException("Interrupted while backing off Google Maps retry", e);
        }
    }
}
