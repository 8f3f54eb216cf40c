package com.movesim.exception;

/**
 * A single sample could not be serialized or a single stored record could not be decoded.
 * Callers contain it per record.
 */
public class SampleEncodingException extends BaseException {

    public SampleEncodingException(String message, Throwable cause) {
        super(ErrorCode.RECORD_UNDECODABLE, message, cause);
    }

    public SampleEncodingException(String message) {
        super(ErrorCode.RECORD_UNDECODABLE, message);
    }
}
