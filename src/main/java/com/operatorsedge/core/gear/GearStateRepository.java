package com.operatorsedge.core.gear;

import com.operatorsedge.core.model.GearState;
import com.operatorsedge.core.store.StateFiles;
import com.operatorsedge.core.store.StateStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Persistence of {@code gear_state.json}. A missing or corrupt file reads as a fresh
 * ACTIVE state entered now.
 */
@Service
public class GearStateRepository {

    private final StateStore store;
    private final Clock clock;

    public GearStateRepository(StateStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Lock-free read for display.
     */
    public GearState snapshot() {
        return store.read(StateFiles.GEAR, GearState.class, this::initial);
    }

    public GearState update(UnaryOperator<GearState> mutator) {
        return store.update(StateFiles.GEAR, GearState.class, this::initial, mutator);
    }

    /**
     * Runs {@code step} against the current state under the file lock and persists the
     * state it returns. Nothing is written if {@code step} throws.
     */
    public <R> R advance(Function<GearState, R> step, Function<R, GearState> stateOf) {
        AtomicReference<R> result = new AtomicReference<>();
        update(current -> {
            R r = step.apply(current);
            result.set(r);
            return stateOf.apply(r);
        });
        return result.get();
    }

    private GearState initial() {
        return GearState.initial(clock.instant());
    }
}
