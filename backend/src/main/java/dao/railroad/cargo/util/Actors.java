package dao.railroad.cargo.util;

import dao.railroad.cargo.error.LedgerError;
import dao.railroad.cargo.error.LedgerException;

import java.util.Locale;

/**
 * Actor ids are opaque strings (0x-prefixed addresses in practice) compared case-insensitively.
 */
public final class Actors {
    private Actors() {}

    public static String normalize(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new LedgerException(LedgerError.INVALID_ARGUMENT, "Actor id must not be blank");
        }
        return actorId.trim().toLowerCase(Locale.ROOT);
    }
}
