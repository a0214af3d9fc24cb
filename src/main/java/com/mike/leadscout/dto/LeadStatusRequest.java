package com.mike.leadscout.dto;

import com.mike.leadscout.entity.LeadStatus;

public record LeadStatusRequest(LeadStatus status) {}
