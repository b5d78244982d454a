package com.intervista.core.state;

/**
 * Callback invoked after a mutation has been installed. Runs on the mutating thread, outside the
 * session lock.
 */
@FunctionalInterface
public interface StateListener {

    void onStateChanged(GraphState previous, GraphState next, StateMutation mutation);
}
