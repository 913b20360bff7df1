package com.jay.finsync.layer1_data;

/** HTTP 429 persisted through every retry. */
public class FmpRateLimitException extends FmpException {

    public FmpRateLimitException(String message) {
        super(message);
    }
}
