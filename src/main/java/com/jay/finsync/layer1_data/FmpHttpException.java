package com.jay.finsync.layer1_data;

/** Non-success HTTP status other than 429. Not retried. */
public class FmpHttpException extends FmpException {

    private final int statusCode;

    public FmpHttpException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
