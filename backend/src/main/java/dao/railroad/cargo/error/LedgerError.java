package dao.railroad.cargo.error;

/**
 * Rejection reasons surfaced by ledger entry points.
 * Each code belongs to exactly one {@link Category}.
 */
public enum LedgerError {

    NOT_OWNER(Category.AUTHORIZATION),
    NOT_PROVIDER(Category.AUTHORIZATION),
    PAUSED(Category.AUTHORIZATION),

    COOLDOWN_ACTIVE(Category.THROTTLING),

    BATCH_CLOSED(Category.LIFECYCLE),
    INVALID_BATCH(Category.LIFECYCLE),
    BATCH_STILL_ACTIVE(Category.LIFECYCLE),
    ALREADY_PAUSED(Category.LIFECYCLE),
    NOT_PAUSED(Category.LIFECYCLE),

    INVALID_COOLDOWN_INTERVAL(Category.VALIDATION),
    INVALID_ARGUMENT(Category.VALIDATION),

    UNINITIALIZED_CIPHERTEXT(Category.INTEGRITY),
    MALFORMED_CLEARTEXT(Category.INTEGRITY),

    /** A provider tried to contribute twice to the same batch. */
    PROVIDER_ALREADY_SUBMITTED(Category.REPLAY),
    /** An oracle callback arrived for a request that was already finalized. */
    DECRYPTION_ALREADY_PROCESSED(Category.REPLAY),

    STALE_WRITE(Category.STALENESS),

    INVALID_STATE_HASH(Category.STATE_DRIFT),

    INVALID_PROOF(Category.PROOF),
    UNKNOWN_REQUEST(Category.PROOF);

    public enum Category {
        AUTHORIZATION,
        THROTTLING,
        LIFECYCLE,
        VALIDATION,
        INTEGRITY,
        REPLAY,
        STALENESS,
        STATE_DRIFT,
        PROOF
    }

    private final Category category;

    LedgerError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    /**
     * Only throttling rejections clear up by themselves; everything else needs the caller to change something.
     */
    public boolean isRetryable() {
        return category == Category.THROTTLING;
    }
}
