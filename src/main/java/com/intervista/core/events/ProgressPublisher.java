package com.intervista.core.events;

import com.intervista.core.model.ProgressEvent;
import com.intervista.core.state.GraphState;
import com.intervista.core.state.StateListener;
import com.intervista.core.state.StateManager;
import com.intervista.core.state.StateMutation;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/**
 * Publishes a {@link ProgressEvent} for every task status change, and one more when a session
 * reaches a final status.
 */
@Component
public class ProgressPublisher implements StateListener {

    private final StateManager stateManager;
    private final EventBus eventBus;

    public ProgressPublisher(StateManager stateManager, EventBus eventBus) {
        this.stateManager = stateManager;
        this.eventBus = eventBus;
    }

    @PostConstruct
    void register() {
        stateManager.addListener(this);
    }

    @Override
    public void onStateChanged(GraphState previous, GraphState next, StateMutation mutation) {
        if (mutation instanceof StateMutation.TransitionTask transition) {
            eventBus.publish(ProgressEvent.taskChanged(next.sessionId(),
                    next.taskState().require(transition.taskId()), next.sessionStatus(), next.updatedAt()));
        }
        if (next.sessionStatus().isFinished() && !previous.sessionStatus().isFinished()) {
            eventBus.publish(ProgressEvent.sessionFinished(next.sessionId(), next.sessionStatus(), next.updatedAt()));
        }
    }
}
