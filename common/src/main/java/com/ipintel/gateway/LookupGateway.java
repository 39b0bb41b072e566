package com.ipintel.gateway;

import com.ipintel.config.GatewayConfig;
import com.ipintel.model.LookupResult;

/**
 * Contract for address-information services (organisation, country, ISP).
 *
 * <p>Implementations acquire their HTTP client inside {@link #init(GatewayConfig)}.  A
 * lookup failure is never fatal for a record: callers degrade to
 * {@link LookupResult#empty()} and carry on.</p>
 */
public interface LookupGateway {

    /**
     * Initialises the gateway with its configuration.  Called once by {@link GatewayFactory}.
     */
    default void init(GatewayConfig config) {
        // no-op by default
    }

    /**
     * Looks up a single address.
     *
     * @param address an IPv4/IPv6 literal, port already stripped
     * @return the fields the service knows; unknown fields stay absent
     * @throws LookupException on network error, timeout, non-2xx status or an unreadable body
     */
    LookupResult lookup(String address) throws LookupException;

    /**
     * Releases resources held by this gateway.
     */
    default void close() {
        // no-op by default
    }
}
