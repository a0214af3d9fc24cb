package com.mike.leadscout.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScrapeCycleResult {
    int postsFound;
    int postsStored;
    int postsAlreadyKnown;

    int leadsCreated;
    int leadsUpdated;

    public String toLogLine() {
        return "postsFound=" + postsFound +
                " postsStored=" + postsStored +
                " postsAlreadyKnown=" + postsAlreadyKnown +
                " leadsCreated=" + leadsCreated +
                " leadsUpdated=" + leadsUpdated;
    }
}
