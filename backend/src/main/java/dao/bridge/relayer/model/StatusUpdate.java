package dao.bridge.relayer.model;

/**
 * Extra columns written together with a status change. Null fields are left untouched.
 */
public record StatusUpdate(Long destinationBlockNumber, String signature) {

    public static StatusUpdate none() {
        return new StatusUpdate(null, null);
    }

    public static StatusUpdate paidOut(long destinationBlockNumber) {
        return new StatusUpdate(destinationBlockNumber, null);
    }

    public static StatusUpdate completed(long destinationBlockNumber, String signature) {
        return new StatusUpdate(destinationBlockNumber, signature);
    }
}
