package com.jay.finsync.layer1_data;

/** Base failure of a call to the FMP API. */
public class FmpException extends RuntimeException {

    public FmpException(String message) {
        super(message);
    }

    public FmpException(String message, Throwable cause) {
        super(message, cause);
    }
}
