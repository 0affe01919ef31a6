package com.goormthonuniv.factmerge.dto;

public enum ConflictStatus {
    RESOLVED,
    UNRESOLVED
}
