package org.nowstart.grammar.data.type;

public enum SizeTier {
    NONE(0.0),
    SMALL(1.0),
    MEDIUM(2.0),
    LARGE(4.0);

    private final double multiplier;

    SizeTier(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }

    public SizeTier stepDown() {
        return switch (this) {
            case LARGE -> MEDIUM;
            case MEDIUM, SMALL -> SMALL;
            case NONE -> NONE;
        };
    }
}
