package org.geoingest.models.domain;

public record Coordinates(
        double latitude,
        double longitude,
        String coordinateSystem
) {
    public static Coordinates wgs84(double latitude, double longitude) {
        return new Coordinates(latitude, longitude, "WGS84");
    }
}
