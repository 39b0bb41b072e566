package com.ipintel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observed remote address with its traffic counters, as read from the input summary.
 *
 * <p>Identity is the {@code rowNumber} (position in the input file): the same address may
 * appear on several rows and each row is enriched independently.</p>
 */
@Value
@Builder
@AllArgsConstructor
public class NetworkRecord {

    int rowNumber;
    String address;
    long totalEvents;
    long connects;
    long disconnects;
    long sends;
    long receives;
    long sendBytes;
    long receiveBytes;

    /**
     * Flat column view of the counters, keyed by output column name.
     * {@code rowNumber} is positional and is not part of the row.
     */
    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("address", address);
        row.put("total_events", Long.toString(totalEvents));
        row.put("connects", Long.toString(connects));
        row.put("disconnects", Long.toString(disconnects));
        row.put("sends", Long.toString(sends));
        row.put("receives", Long.toString(receives));
        row.put("send_bytes", Long.toString(sendBytes));
        row.put("receive_bytes", Long.toString(receiveBytes));
        return row;
    }
}
