package com.trading.assetgraph.viz;

/** A point in layout space. 2D layouts leave {@code z} at zero. */
public record Position(double x, double y, double z) {
    public static final Position ORIGIN = new Position(0.0, 0.0, 0.0);

    public static Position of(double x, double y) {
        return new Position(x, y, 0.0);
    }

    /** {@code this + t * (other - this)}. */
    public Position towards(Position other, double t) {
        return new Position(
                x + t * (other.x - x),
                y + t * (other.y - y),
                z + t * (other.z - z));
    }

    public double[] toArray() {
        return new double[] { x, y, z };
    }
}
