package com.mike.leadscout.entity;

public enum LeadStatus {
    NEW, VIEWED, INTERESTED, NOT_INTERESTED, MARKED_LATER, ARCHIVED
}
