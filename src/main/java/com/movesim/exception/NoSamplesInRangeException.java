package com.movesim.exception;

/**
 * The requested window of a user's history holds no samples, either because nothing was ever
 * recorded for the user or because the window is empty.
 */
public class NoSamplesInRangeException extends BaseException {

    public NoSamplesInRangeException(String userId) {
        super(ErrorCode.NO_DATA_IN_RANGE, "No data found for user " + userId + " within the specified range");
    }
}
