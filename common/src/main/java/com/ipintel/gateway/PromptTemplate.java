package com.ipintel.gateway;

import com.ipintel.model.LookupResult;
import com.ipintel.model.NetworkRecord;

/**
 * Fixed instruction template sent to the assessment service.
 *
 * <p>Asks for one field per line with exact field-name prefixes and a colon-space
 * separator, no punctuation other than hyphens and periods (the answer ends up in a CSV
 * cell) and per-field word ceilings.</p>
 */
public class PromptTemplate {

    static final int PURPOSE_WORD_LIMIT = 20;
    static final int CONCERNS_WORD_LIMIT = 15;
    static final int RECOMMENDATION_WORD_LIMIT = 20;

    private final boolean includeRiskScore;

    public PromptTemplate(boolean includeRiskScore) {
        this.includeRiskScore = includeRiskScore;
    }

    public String render(NetworkRecord record, LookupResult lookup) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a cybersecurity analyst specialising in network behaviour analysis ")
                .append("and threat detection.\n\n");

        prompt.append("INPUT DATA:\n")
                .append("- IP Address: ").append(record.getAddress()).append('\n')
                .append("- Organization: ").append(lookup.organization().orElse("unknown")).append('\n')
                .append("- Country: ").append(lookup.country().orElse("unknown")).append('\n')
                .append("- ISP: ").append(lookup.isp().orElse("unknown")).append('\n');
        if (!lookup.getPorts().isEmpty()) {
            prompt.append("- Open Ports: ").append(lookup.getPorts()).append('\n');
        }
        prompt.append("- Total Events: ").append(record.getTotalEvents()).append('\n')
                .append("- Connection Events: ").append(record.getConnects()).append(" connects | ")
                .append(record.getDisconnects()).append(" disconnects\n")
                .append("- Data Transfer: ").append(record.getSends()).append(" sends (")
                .append(record.getSendBytes()).append(" bytes) | ").append(record.getReceives())
                .append(" receives (").append(record.getReceiveBytes()).append(" bytes)\n\n");

        prompt.append("Provide a security assessment in exactly this format:\n")
                .append("IP: ").append(record.getAddress()).append('\n')
                .append("Trustworthiness: <score 1-100>\n")
                .append("Primary Purpose: <single line description maximum ")
                .append(PURPOSE_WORD_LIMIT).append(" words>\n")
                .append("Security Concerns: <start with YES or NO then explanation maximum ")
                .append(CONCERNS_WORD_LIMIT).append(" words>\n");
        if (includeRiskScore) {
            prompt.append("Risk Score: <score 1-100>\n");
        }
        prompt.append("Recommendation: <start with No action required or Requires Attention then maximum ")
                .append(RECOMMENDATION_WORD_LIMIT).append(" words>\n\n");

        prompt.append("FORMAT RULES:\n")
                .append("1. Do not use commas or special characters - only hyphens and periods are allowed\n")
                .append("2. Each field must be on its own line\n")
                .append("3. Use the exact field names shown above\n")
                .append("4. Each field name is followed by exactly one colon and a space\n")
                .append("5. Keep every field within its word limit\n")
                .append("6. Do not add any other text or formatting\n\n");

        prompt.append("Base trustworthiness on known reputation of the address, the organization and ISP, ")
                .append("communication patterns, data volume ratios and connection frequency. ")
                .append("Weigh unusual port usage, asymmetric transfer, connection anomalies and ")
                .append("geographic concerns as risk factors.\n");
        return prompt.toString();
    }
}
