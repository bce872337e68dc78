package dao.railroad.cargo.event;

import java.util.List;

public interface EventJournal {

    JournalEntry append(LedgerEvent event);

    List<JournalEntry> findAll();

    List<JournalEntry> findSince(long afterSequence);

    <T extends LedgerEvent> List<T> findByType(Class<T> type);

    long size();
}
