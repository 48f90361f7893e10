package com.fieldservice.scheduling.distance;

public record Coordinates(double latitude, double longitude) {
}
