package org.nowstart.grammar.engine.policy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.nowstart.grammar.data.type.Direction;
import org.nowstart.grammar.data.type.Outcome;
import org.nowstart.grammar.engine.core.ZoneId;

class RetryBookTest {

    private final RetryBook book = new RetryBook();
    private final ZoneId zone = new ZoneId(1000, 1100);

    @Test
    void recordEntry_marksFollowingCandidatesAsRetries() {
        assertThat(book.isRetry(zone, Direction.SHORT)).isFalse();

        book.recordEntry(zone, Direction.SHORT);
        book.recordEntry(zone, Direction.SHORT);

        assertThat(book.isRetry(zone, Direction.SHORT)).isTrue();
        assertThat(book.retriesUsed(zone, Direction.SHORT)).isEqualTo(1);
        assertThat(book.isRetry(zone, Direction.LONG)).isFalse();
    }

    @Test
    void recordOutcome_keepsEntriesOnWinAndClearsOnLoss() {
        book.recordEntry(zone, Direction.SHORT);

        book.recordOutcome(zone, Direction.SHORT, Outcome.WIN);
        assertThat(book.entriesInStreak(zone, Direction.SHORT)).isEqualTo(1);

        book.recordOutcome(zone, Direction.SHORT, Outcome.LOSS);
        assertThat(book.entriesInStreak(zone, Direction.SHORT)).isZero();
    }

    @Test
    void recordOutcome_clearsOppositeDirection() {
        book.recordEntry(zone, Direction.LONG);

        book.recordOutcome(zone, Direction.SHORT, Outcome.WIN);

        assertThat(book.isRetry(zone, Direction.LONG)).isFalse();
    }

    @Test
    void reset_clearsEverything() {
        book.recordEntry(zone, Direction.LONG);

        book.reset();

        assertThat(book.entriesInStreak(zone, Direction.LONG)).isZero();
    }
}
