package dao.bridge.relayer.service;

/**
 * Result of the two-phase completion stage for one transfer.
 */
public enum CompletionOutcome {
    /** complete() confirmed on L2 and the record updated. */
    COMPLETED,
    /** L2 already reports Completed or Refunded; nothing written. */
    SKIPPED_TERMINAL,
    /** L2 reports a status outside the known enum; nothing written. */
    SKIPPED_UNEXPECTED,
    /** Status read, submission or record update failed; the record stays pending. */
    FAILED
}
