package com.fieldservice.scheduling.distance;

import java.math.BigDecimal;
import java.util.List;

/**
 * Road distance and travel time between two coordinates.
 * Implementations are network-bound and may be slow or fail.
 */
public interface DistanceProvider {

    /** Distance in miles. */
    BigDecimal getDistance(double originLat, double originLng, double destLat, double destLng);

    /** Travel time in whole minutes. */
    int getTravelTime(double originLat, double originLng, double destLat, double destLng);

    /** Matrix indexed [origin][destination]. */
    List<List<DistanceResult>> getDistanceBatch(List<Coordinates> origins, List<Coordinates> destinations);
}
