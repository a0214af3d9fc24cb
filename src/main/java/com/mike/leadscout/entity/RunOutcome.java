package com.mike.leadscout.entity;

public enum RunOutcome {
    SUCCESS, FAILURE
}
