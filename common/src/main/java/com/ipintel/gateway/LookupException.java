package com.ipintel.gateway;

/**
 * Failed address lookup.  Non-fatal: the record continues with absent lookup fields.
 */
public class LookupException extends Exception {

    private static final long serialVersionUID = 1L;

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
