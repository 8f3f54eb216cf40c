package com.movesim.exception;

/**
 * The sample store is closed or unreachable. Fatal to the operation that hit it and never retried.
 */
public class StoreUnavailableException extends BaseException {

    public StoreUnavailableException(String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
