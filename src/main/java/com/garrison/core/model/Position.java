package com.garrison.core.model;

/**
 * World position in meters.
 */
public record Position(double x, double y, double z) {

    public double distanceSquaredTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    public boolean isWithin(Position other, double radius) {
        return distanceSquaredTo(other) < radius * radius;
    }

    public Position offset(double dx, double dz) {
        return new Position(x + dx, y, z + dz);
    }
}
