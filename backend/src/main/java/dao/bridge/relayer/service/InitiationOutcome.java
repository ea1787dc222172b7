package dao.bridge.relayer.service;

/**
 * What happened to one observed BridgeInitiated event.
 */
public enum InitiationOutcome {
    /** Record already present; nothing written. */
    ALREADY_RECORDED,
    /** L2 status is not Pending; nothing written. */
    NOT_PENDING,
    /** Insert raced with an existing record; no payout. */
    CONFLICT,
    /** Recorded as pending but the payout failed; the record stays pending. */
    PAYOUT_FAILED,
    /** Payout confirmed and the record marked completed (completion stage disabled). */
    PAID_OUT,
    /** Payout confirmed and complete() accepted on L2. */
    COMPLETED,
    /** Payout confirmed; completion skipped because L2 already left Pending. */
    COMPLETION_SKIPPED,
    /** Payout confirmed; completion failed. The record stays pending. */
    COMPLETION_FAILED,
    /** Unexpected error (status read, store access); the event is skipped. */
    ERROR;

    public boolean paidOut() {
        return this == PAID_OUT || this == COMPLETED || this == COMPLETION_SKIPPED || this == COMPLETION_FAILED;
    }
}
