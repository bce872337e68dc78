package dao.railroad.cargo.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Repository
public class InMemoryEventJournal implements EventJournal {

    private final List<JournalEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong(1);
    private final Clock clock;

    public InMemoryEventJournal(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized JournalEntry append(LedgerEvent event) {
        JournalEntry entry = new JournalEntry(sequence.getAndIncrement(), clock.instant(), event);
        entries.add(entry);
        log.debug("event #{} {}", entry.sequence(), event);
        return entry;
    }

    @Override
    public List<JournalEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public List<JournalEntry> findSince(long afterSequence) {
        List<JournalEntry> out = new ArrayList<>();
        for (JournalEntry e : entries) {
            if (e.sequence() > afterSequence) out.add(e);
        }
        return out;
    }

    @Override
    public <T extends LedgerEvent> List<T> findByType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (JournalEntry e : entries) {
            if (type.isInstance(e.event())) out.add(type.cast(e.event()));
        }
        return out;
    }

    @Override
    public long size() {
        return entries.size();
    }
}
