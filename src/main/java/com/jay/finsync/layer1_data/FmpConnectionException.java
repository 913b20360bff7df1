package com.jay.finsync.layer1_data;

public class FmpConnectionException extends FmpException {

    public FmpConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
