package com.jay.finsync.layer1_data;

public class FmpTimeoutException extends FmpException {

    public FmpTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
