package com.operatorsedge.core.model;

/**
 * Operating mode of the supervisor.
 */
public enum GearMode {
    ACTIVE,   // objective with unfinished steps; executes the next step
    PATROL,   // no unfinished step; scans for new issues
    DREAM     // fully idle; consolidates and proposes objectives
}
