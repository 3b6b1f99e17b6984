package com.operatorsedge.core.dream;

/**
 * A candidate objective offered while idle.
 *
 * @param objective proposed objective text
 * @param basis     where the idea came from, e.g. {@code lesson} or {@code risk}
 */
public record DreamProposal(String objective, String basis) {}
