package com.mike.leadscout.entity;

public enum ConnectionStatus {
    CONNECTED, DISCONNECTED, ERROR
}
