package com.tennis.engine.rules;

/**
 * Pressure situation of a point, computed before it is played.
 */
public record PointFlags(boolean breakPoint, boolean gamePoint, boolean setPoint, boolean matchPoint) {

    public static final PointFlags NONE = new PointFlags(false, false, false, false);
}
