package dao.railroad.cargo.service;

import dao.railroad.cargo.config.LedgerProperties;
import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.event.EventJournal;
import dao.railroad.cargo.event.LedgerEvent;
import dao.railroad.cargo.util.Actors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-actor minimum-interval throttle for mutating calls.
 * <p>
 * A call is admitted when {@code now >= lastAction + cooldownInterval}; an actor without a record is always admitted.
 * Callers that have further checks to run use {@link #ensureReady(String)} first and {@link #record(String)} once the
 * whole call has gone through, so a rejected call never moves {@code lastAction}.
 */
@Slf4j
@Component
public class CooldownGate {

    /** Protocol floor: the interval can never be lowered past this. */
    public static final Duration MIN_INTERVAL = Duration.ofSeconds(10);

    private final AccessControlService accessControl;
    private final EventJournal journal;
    private final Clock clock;
    private final Map<String, Instant> lastAction = new ConcurrentHashMap<>();
    private volatile Duration cooldownInterval;

    public CooldownGate(LedgerProperties ledgerProps,
                        AccessControlService accessControl,
                        EventJournal journal,
                        Clock clock) {
        this.accessControl = accessControl;
        this.journal = journal;
        this.clock = clock;
        Duration configured = ledgerProps.getCooldownInterval();
        if (configured == null || configured.compareTo(MIN_INTERVAL) < 0) {
            throw new IllegalStateException("ledger.cooldown-interval must be at least " + MIN_INTERVAL + " (got " + configured + ")");
        }
        this.cooldownInterval = configured;
    }

    public void ensureReady(String actor) {
        String id = Actors.normalize(actor);
        Instant last = lastAction.get(id);
        if (last == null) return;

        Instant next = last.plus(cooldownInterval);
        Instant now = clock.instant();
        if (now.isBefore(next)) {
            log.debug("Cooldown active for {} until {}", id, next);
            throw new LedgerException(LedgerError.COOLDOWN_ACTIVE,
                    "Cooldown active for " + id + " until " + next);
        }
    }

    public void record(String actor) {
        lastAction.put(Actors.normalize(actor), clock.instant());
    }

    public void checkAndRecord(String actor) {
        ensureReady(actor);
        record(actor);
    }

    public void setCooldownInterval(String caller, Duration newInterval) {
        accessControl.requireOwner(caller);
        if (newInterval == null || newInterval.compareTo(MIN_INTERVAL) < 0) {
            throw new LedgerException(LedgerError.INVALID_COOLDOWN_INTERVAL,
                    "Cooldown interval " + newInterval + " is below the minimum of " + MIN_INTERVAL);
        }
        Duration old = cooldownInterval;
        cooldownInterval = newInterval;
        journal.append(new LedgerEvent.CooldownUpdated(old, newInterval));
        log.info("Cooldown interval updated: {} -> {}", old, newInterval);
    }

    public Duration cooldownInterval() {
        return cooldownInterval;
    }

    public Optional<Instant> lastAction(String actor) {
        return Optional.ofNullable(lastAction.get(Actors.normalize(actor)));
    }

    /**
     * Earliest instant the actor may make another throttled call, or empty if it may call right away.
     */
    public Optional<Instant> nextAllowedAt(String actor) {
        return lastAction(actor)
                .map(last -> last.plus(cooldownInterval))
                .filter(next -> clock.instant().isBefore(next));
    }
}
