package com.ipintel.io;

import java.io.IOException;

/**
 * The input summary is missing a required column or has an unreadable counter.
 */
public class InputFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
