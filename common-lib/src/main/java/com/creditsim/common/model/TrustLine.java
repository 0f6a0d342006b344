package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Directed credit relation: {@code from} (creditor) lets {@code to} (debtor)
 * owe it up to {@code limit} in {@code equivalent}. Only active lines carry capacity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrustLine(
    @JsonProperty("from")       String from,
    @JsonProperty("to")         String to,
    @JsonProperty("equivalent") String equivalent,
    @JsonProperty("limit")      BigDecimal limit,
    @JsonProperty("status")     String status
) {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_FROZEN = "frozen";
    public static final String STATUS_CLOSED = "closed";

    @JsonIgnore
    public boolean isActive() {
        return status == null || status.isBlank() || STATUS_ACTIVE.equalsIgnoreCase(status.trim());
    }

    public TrustLine withLimit(BigDecimal newLimit) {
        return new TrustLine(from, to, equivalent, newLimit, status);
    }

    public TrustLine withStatus(String newStatus) {
        return new TrustLine(from, to, equivalent, limit, newStatus);
    }

    /** {@code creditor:debtor:EQ} */
    @JsonIgnore
    public String key() {
        return key(from, to, equivalent);
    }

    public static String key(String creditor, String debtor, String equivalent) {
        return creditor + ":" + debtor + ":" + equivalent;
    }
}
