package com.operatorsedge.core.qualitygate;

/**
 * One failed quality check.
 *
 * @param check   stable check name, used to scope approvals
 * @param message human-readable detail
 */
public record QualityCheckFailure(String check, String message) {}
