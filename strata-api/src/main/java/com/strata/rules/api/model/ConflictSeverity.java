package com.strata.rules.api.model;

public enum ConflictSeverity {
    INFO,
    WARNING,
    ERROR
}
