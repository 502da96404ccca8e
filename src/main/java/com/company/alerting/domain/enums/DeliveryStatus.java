package com.company.alerting.domain.enums;

public enum DeliveryStatus {
    DELIVERED("Delivered to the channel"),
    RETRYING("Delivery still in progress after a transient failure"),
    DEAD_LETTERED("Retries exhausted or permanent failure, written to the dead-letter store"),
    SKIPPED_SUPPRESSED("Withheld by a suppression rule"),
    SKIPPED_DEDUPED("Coalesced with an identical event inside the dedup window"),
    SKIPPED_UNCHANGED("State did not change, nothing to notify"),
    DROPPED_UNCLASSIFIED("Event source could not be classified");

    private final String description;

    DeliveryStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
