package dao.bridge.relayer.model;

import lombok.Data;

/**
 * Row of the record store (table bridged_events), keyed by transferId.
 */
@Data
public class TransferRecord {

    /** bytes32 transfer id, lowercase 0x-prefixed hex. Opaque key. */
    private String transferId;
    private String recipient;
    private String bridgedAmount;     // string decimal (uint256)
    private TransferStatus status;
    private long sourceBlockNumber;
    /** L1 block of the confirmed payout; null until paid out. */
    private Long destinationBlockNumber;
    private long timestamp;           // unix seconds, from the initiation event
    /** 0x-prefixed 65-byte completion signature; null unless the completion stage ran. */
    private String signature;

    public TransferRecord copy() {
        TransferRecord c = new TransferRecord();
        c.setTransferId(transferId);
        c.setRecipient(recipient);
        c.setBridgedAmount(bridgedAmount);
        c.setStatus(status);
        c.setSourceBlockNumber(sourceBlockNumber);
        c.setDestinationBlockNumber(destinationBlockNumber);
        c.setTimestamp(timestamp);
        c.setSignature(signature);
        return c;
    }
}
