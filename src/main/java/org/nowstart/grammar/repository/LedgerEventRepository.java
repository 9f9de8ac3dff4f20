package org.nowstart.grammar.repository;

import java.util.List;
import org.nowstart.grammar.data.entity.LedgerEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {

    List<LedgerEvent> findByInstrumentOrderBySequenceAsc(String instrument);
}
