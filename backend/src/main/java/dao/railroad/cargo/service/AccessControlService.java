package dao.railroad.cargo.service;

import dao.railroad.cargo.config.LedgerProperties;
import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;
import dao.railroad.cargo.event.EventJournal;
import dao.railroad.cargo.event.LedgerEvent;
import dao.railroad.cargo.util.Actors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owner, provider allowlist and the pause switch.
 * <p>
 * Only the owner mutates membership. Every mutating entry point other than owner administration
 * must call {@link #requireNotPaused()}.
 */
@Slf4j
@Service
public class AccessControlService {

    private final EventJournal journal;
    private final Set<String> providers = ConcurrentHashMap.newKeySet();
    private volatile String owner;
    private volatile boolean paused;

    public AccessControlService(LedgerProperties ledgerProps, EventJournal journal) {
        this.journal = journal;
        if (ledgerProps.getOwner() == null || ledgerProps.getOwner().isBlank()) {
            throw new IllegalStateException("ledger.owner must be configured");
        }
        this.owner = Actors.normalize(ledgerProps.getOwner());

        // Spring may bind `ledger.providers` as a real list or as a single comma-separated string.
        List<String> configured = ledgerProps.getProviders() == null ? List.of() : ledgerProps.getProviders();
        for (String entry : configured) {
            if (entry == null) continue;
            for (String part : entry.split(",")) {
                String p = part.trim();
                if (!p.isEmpty()) providers.add(Actors.normalize(p));
            }
        }

        log.info("AccessControlService initialized: owner={}, providers={}", owner, providers.size());
    }

    public void requireOwner(String caller) {
        if (!owner.equals(Actors.normalize(caller))) {
            throw new LedgerException(LedgerError.NOT_OWNER, "Caller is not the owner: " + caller);
        }
    }

    public void requireProvider(String caller) {
        if (!providers.contains(Actors.normalize(caller))) {
            throw new LedgerException(LedgerError.NOT_PROVIDER, "Caller is not a registered provider: " + caller);
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw new LedgerException(LedgerError.PAUSED, "Ledger is paused");
        }
    }

    public void addProvider(String caller, String provider) {
        requireOwner(caller);
        String id = Actors.normalize(provider);
        if (providers.add(id)) {
            journal.append(new LedgerEvent.ProviderAdded(id));
            log.info("Provider added: {}", id);
        }
    }

    public void removeProvider(String caller, String provider) {
        requireOwner(caller);
        String id = Actors.normalize(provider);
        if (providers.remove(id)) {
            journal.append(new LedgerEvent.ProviderRemoved(id));
            log.info("Provider removed: {}", id);
        }
    }

    public void pause(String caller) {
        requireOwner(caller);
        if (paused) {
            throw new LedgerException(LedgerError.ALREADY_PAUSED, "Ledger is already paused");
        }
        paused = true;
        journal.append(new LedgerEvent.Paused(owner));
        log.warn("Ledger paused by {}", owner);
    }

    public void unpause(String caller) {
        requireOwner(caller);
        if (!paused) {
            throw new LedgerException(LedgerError.NOT_PAUSED, "Ledger is not paused");
        }
        paused = false;
        journal.append(new LedgerEvent.Unpaused(owner));
        log.info("Ledger unpaused by {}", owner);
    }

    public void transferOwnership(String caller, String newOwner) {
        requireOwner(caller);
        String next = Actors.normalize(newOwner);
        String previous = owner;
        owner = next;
        journal.append(new LedgerEvent.OwnershipTransferred(previous, next));
        log.info("Ownership transferred: {} -> {}", previous, next);
    }

    public String owner() {
        return owner;
    }

    public boolean isProvider(String actor) {
        return providers.contains(Actors.normalize(actor));
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Availability as reported to game clients: the ledger accepts mutating calls.
     */
    public boolean isAvailable() {
        return !paused;
    }

    public List<String> providers() {
        return new ArrayList<>(new TreeSet<>(providers));
    }
}
