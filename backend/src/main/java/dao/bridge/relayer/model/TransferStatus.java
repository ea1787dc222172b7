package dao.bridge.relayer.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a bridge transfer.
 * <p>
 * Codes mirror the L2 contract enum (0 = Pending, 1 = Completed, 2 = Refunded).
 * Store values are the lowercase strings persisted in the record store.
 */
public enum TransferStatus {
    PENDING(0),
    COMPLETED(1),
    REFUNDED(2);

    private final int code;

    TransferStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public String storeValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Map an on-chain status code. Unknown codes yield empty: callers treat them as non-pending.
     */
    public static Optional<TransferStatus> fromCode(int code) {
        for (TransferStatus s : values()) {
            if (s.code == code) return Optional.of(s);
        }
        return Optional.empty();
    }

    public static TransferStatus fromStoreValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
