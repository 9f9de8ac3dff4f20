package org.nowstart.grammar.service;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.grammar.data.entity.LedgerEvent;
import org.nowstart.grammar.data.property.LockedDoctrine;
import org.nowstart.grammar.engine.core.ZoneOutcomeEvent;
import org.nowstart.grammar.repository.LedgerEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable copy of the zone ledger's outcome events. The in-memory ledger stays authoritative for decisions.
 */
@Service
@RequiredArgsConstructor
public class LedgerJournalService {

    private final LedgerEventRepository ledgerEventRepository;
    private final LockedDoctrine lockedDoctrine;

    @Transactional
    public List<LedgerEvent> journal(String instrument, List<ZoneOutcomeEvent> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return List.of();
        }
        List<LedgerEvent> entities = outcomes.stream()
                .map(outcome -> LedgerEvent.builder()
                        .instrument(instrument)
                        .doctrineVersion(lockedDoctrine.version())
                        .sequence(outcome.sequence())
                        .zoneId(outcome.zoneId().label())
                        .direction(outcome.direction())
                        .outcome(outcome.outcome())
                        .retestCount(outcome.retest().retestCount())
                        .recoveryBars(outcome.retest().recoveryBars())
                        .barIndex(outcome.barIndex())
                        .live(outcome.live())
                        .build())
                .toList();
        return ledgerEventRepository.saveAll(entities);
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> history(String instrument) {
        return ledgerEventRepository.findByInstrumentOrderBySequenceAsc(instrument);
    }
}
