package org.nowstart.grammar.data.type;

/**
 * Discrete certification level θ. {@link #LOCK_IN} stands for every θ of three or more.
 */
public enum CertificationLevel {
    NO_STATE(0),
    BIRTH(1),
    TRANSITION(2),
    LOCK_IN(3);

    private final int theta;

    CertificationLevel(int theta) {
        this.theta = theta;
    }

    public int theta() {
        return theta;
    }

    public boolean isCertified() {
        return theta >= 1;
    }

    public static CertificationLevel ofTheta(int theta) {
        if (theta <= 0) {
            return NO_STATE;
        }
        if (theta == 1) {
            return BIRTH;
        }
        if (theta == 2) {
            return TRANSITION;
        }
        return LOCK_IN;
    }
}
