package com.operatorsedge.core.store;

import java.util.List;

/**
 * Names of the documents kept in the state directory.
 */
public final class StateFiles {

    public static final String GEAR = "gear_state.json";
    public static final String JUNCTION = "junction_state.json";
    public static final String LOOP = "loop_state.json";

    /** Written by earlier releases; read for migration, never written. */
    public static final String LEGACY_DISPATCH = "dispatch_state.json";

    public static final List<String> CURRENT = List.of(GEAR, JUNCTION, LOOP);

    private StateFiles() {}
}
