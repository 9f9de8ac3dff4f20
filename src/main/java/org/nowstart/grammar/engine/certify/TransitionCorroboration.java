package org.nowstart.grammar.engine.certify;

import org.nowstart.grammar.engine.core.PersistenceRecord;

/**
 * Extra evidence a zone on a two-win streak must show before it is certified as TRANSITION.
 */
@FunctionalInterface
public interface TransitionCorroboration {

    boolean holds(PersistenceRecord record);
}
