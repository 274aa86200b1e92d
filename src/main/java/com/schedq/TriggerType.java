package com.schedq;

public enum TriggerType {
    SCHEDULED,
    MANUAL,
    RETRY
}
