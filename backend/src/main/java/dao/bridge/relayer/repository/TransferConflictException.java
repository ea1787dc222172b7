package dao.bridge.relayer.repository;

/**
 * Insert on an existing transferId. Signals earlier successful processing, not corruption.
 */
public class TransferConflictException extends RuntimeException {

    private final String transferId;

    public TransferConflictException(String transferId) {
        super("Transfer already recorded: " + transferId);
        this.transferId = transferId;
    }

    public TransferConflictException(String transferId, Throwable cause) {
        super("Transfer already recorded: " + transferId, cause);
        this.transferId = transferId;
    }

    public String getTransferId() {
        return transferId;
    }
}
