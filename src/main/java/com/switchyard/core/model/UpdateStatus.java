package com.switchyard.core.model;

public enum UpdateStatus {
    SUCCESS,
    ALREADY_UP_TO_DATE,
    HAS_UNCOMMITTED_CHANGES,
    HAS_CONFLICTS,
    MERGE_FAILED,
    NO_SESSION
}
