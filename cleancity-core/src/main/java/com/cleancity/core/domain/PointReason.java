package com.cleancity.core.domain;

public enum PointReason {
    REPORT_VERIFIED,
    HIGH_SEVERITY_REPORT,
    CONSECUTIVE_DAYS,
    FIRST_IN_AREA
}
