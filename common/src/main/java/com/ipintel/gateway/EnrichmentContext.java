package com.ipintel.gateway;

import com.ipintel.model.LookupResult;
import com.ipintel.model.NetworkRecord;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything an assessment gateway needs for one record.
 */
@Value
public class EnrichmentContext {

    @NonNull NetworkRecord record;
    @NonNull LookupResult lookup;
    @NonNull PromptTemplate template;

    public String prompt() {
        return template.render(record, lookup);
    }
}
