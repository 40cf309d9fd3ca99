package com.brigade.vacuum.core.model;

public enum ResourceKind {
    WORKER,
    RECORD
}
