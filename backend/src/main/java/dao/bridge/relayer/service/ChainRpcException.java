package dao.bridge.relayer.service;

/**
 * A chain RPC call, view call or transaction submission failed.
 * Treated as transient: callers retry where a retry policy applies, otherwise skip for this cycle.
 */
public class ChainRpcException extends RuntimeException {

    public ChainRpcException(String message) {
        super(message);
    }

    public ChainRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
