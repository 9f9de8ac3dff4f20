package org.nowstart.grammar.data.type;

public enum Direction {
    LONG(1),
    SHORT(-1);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    /**
     * Signed move from {@code from} to {@code to}, positive when the move is in this direction's favour.
     */
    public double favorable(double from, double to) {
        return (to - from) * sign;
    }

    /**
     * Price {@code distance} units away from {@code anchor} on the favourable side.
     */
    public double offset(double anchor, double distance) {
        return anchor + (distance * sign);
    }
}
