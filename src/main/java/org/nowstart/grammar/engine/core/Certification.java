package org.nowstart.grammar.engine.core;

import org.nowstart.grammar.data.type.CertificationLevel;

public record Certification(
        int theta,
        CertificationLevel level,
        int winStreak,
        String reason
) {

    public Certification {
        if (theta < 0) {
            throw new IllegalArgumentException("theta must be non-negative");
        }
        if (level != CertificationLevel.ofTheta(theta)) {
            throw new IllegalArgumentException("level does not match theta");
        }
    }

    public static Certification of(int theta, int winStreak, String reason) {
        return new Certification(theta, CertificationLevel.ofTheta(theta), winStreak, reason);
    }

    public static Certification none(String reason) {
        return of(0, 0, reason);
    }

    public boolean isCertified() {
        return level.isCertified();
    }
}
