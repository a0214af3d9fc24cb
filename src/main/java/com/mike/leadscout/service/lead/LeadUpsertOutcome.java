package com.mike.leadscout.service.lead;

public enum LeadUpsertOutcome {
    CREATED, UPDATED, UNCHANGED
}
