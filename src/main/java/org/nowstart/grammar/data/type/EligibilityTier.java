package org.nowstart.grammar.data.type;

/**
 * ELEVATED marks the first ignition of a sequence, STANDARD a re-entry inside the ignition cooldown.
 */
public enum EligibilityTier {
    ELEVATED,
    STANDARD
}
