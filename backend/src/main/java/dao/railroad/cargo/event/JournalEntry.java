package dao.railroad.cargo.event;

import java.time.Instant;

/**
 * An event as recorded in the journal: sequence numbers start at 1 and never repeat.
 */
public record JournalEntry(
        long sequence,
        Instant recordedAt,
        LedgerEvent event
) {}
