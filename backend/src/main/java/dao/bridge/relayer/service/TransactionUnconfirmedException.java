package dao.bridge.relayer.service;

/**
 * The transaction was broadcast but no receipt was observed. It may still be mined:
 * poll {@link #getTxHash()} again, never re-send.
 */
public class TransactionUnconfirmedException extends ChainRpcException {

    private final String txHash;

    public TransactionUnconfirmedException(String txHash, String message, Throwable cause) {
        super(message, cause);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
