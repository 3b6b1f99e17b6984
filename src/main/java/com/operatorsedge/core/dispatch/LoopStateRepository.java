package com.operatorsedge.core.dispatch;

import com.operatorsedge.core.store.StateFiles;
import com.operatorsedge.core.store.StateStore;
import org.springframework.stereotype.Service;

import java.util.function.UnaryOperator;

/**
 * Persistence of {@code loop_state.json}.
 */
@Service
public class LoopStateRepository {

    private final StateStore store;

    public LoopStateRepository(StateStore store) {
        this.store = store;
    }

    public LoopState snapshot() {
        return store.read(StateFiles.LOOP, LoopState.class, LoopState::initial);
    }

    public LoopState update(UnaryOperator<LoopState> mutator) {
        return store.update(StateFiles.LOOP, LoopState.class, LoopState::initial, mutator);
    }
}
