package com.ryuqq.loadlifecycle.core.model;

/**
 * 위도/경도 좌표.
 *
 * @param latitude 위도 (-90 ~ 90)
 * @param longitude 경도 (-180 ~ 180)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record GeoPoint(double latitude, double longitude) {

    private static final double EARTH_RADIUS_MILES = 3958.8;

    public GeoPoint {
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException(
                "latitude must be between -90 and 90 (current: " + latitude + ")"
            );
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException(
                "longitude must be between -180 and 180 (current: " + longitude + ")"
            );
        }
    }

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Haversine 공식으로 두 좌표 사이의 거리(마일)를 계산.
     *
     * @param other 비교 좌표
     * @return 대권 거리 (마일)
     */
    public double distanceMilesTo(GeoPoint other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        double dLat = Math.toRadians(other.latitude - latitude);
        double dLng = Math.toRadians(other.longitude - longitude);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(other.latitude))
            * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return EARTH_RADIUS_MILES * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}
