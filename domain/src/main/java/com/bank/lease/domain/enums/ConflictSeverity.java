package com.bank.lease.domain.enums;

public enum ConflictSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
