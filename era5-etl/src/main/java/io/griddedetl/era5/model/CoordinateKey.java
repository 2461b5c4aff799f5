package io.griddedetl.era5.model;

/**
 * (time, latitude, longitude) join key. Latitude and longitude compare numerically, with
 * negative zero folded into zero.
 */
public record CoordinateKey(String time, double latitude, double longitude) {
    public CoordinateKey {
        latitude = latitude + 0.0;
        longitude = longitude + 0.0;
    }
}
