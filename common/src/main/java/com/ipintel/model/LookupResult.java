package com.ipintel.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Address information returned by a lookup gateway.
 *
 * <p>Every field is optional: a backend that does not know a value leaves it {@code null}
 * rather than inventing one.  {@link #empty()} is used when the lookup failed altogether.</p>
 */
@Value
@Builder
public class LookupResult {

    private static final LookupResult EMPTY = LookupResult.builder().build();

    String organization;
    String country;
    String isp;
    @Singular
    List<Integer> ports;

    public static LookupResult empty() {
        return EMPTY;
    }

    public Optional<String> organization() {
        return Optional.ofNullable(organization);
    }

    public Optional<String> country() {
        return Optional.ofNullable(country);
    }

    public Optional<String> isp() {
        return Optional.ofNullable(isp);
    }

    public boolean isEmpty() {
        return organization == null && country == null && isp == null && ports.isEmpty();
    }

    /**
     * Column view: absent values become empty cells, the port list is a single
     * {@code ", "}-joined cell.
     */
    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("organization", organization().orElse(""));
        row.put("country", country().orElse(""));
        row.put("isp", isp().orElse(""));
        row.put("ports", ports.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        return row;
    }
}
