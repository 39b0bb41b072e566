package com.ipintel.enrichment;

/**
 * The thread running an {@link EnrichmentPool} was interrupted; workers have been stopped.
 */
public class EnrichmentInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EnrichmentInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
