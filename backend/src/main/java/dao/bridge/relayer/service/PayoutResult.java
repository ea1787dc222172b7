package dao.bridge.relayer.service;

/**
 * Outcome of a payout submission: the confirmed receipt, or the error left after the last attempt.
 * {@code unconfirmedTxHash} is set when a payout tx was broadcast but never observed.
 */
public record PayoutResult(
        String transferId,
        ChainReceipt receipt,
        int attempts,
        String error,
        String unconfirmedTxHash
) {

    public boolean confirmed() {
        return receipt != null;
    }
}
