package com.flagship.trade_finance.query;

/**
 * The query service failed or answered with an error status.
 */
public class QueryServiceException extends RuntimeException {

    private final int status;

    public QueryServiceException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
