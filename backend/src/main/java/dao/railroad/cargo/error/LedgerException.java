package dao.railroad.cargo.error;

import lombok.Getter;

/**
 * Thrown by every ledger entry point that rejects a call. The ledger state is untouched when this is thrown.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerError.Category getCategory() {
        return error.category();
    }
}
