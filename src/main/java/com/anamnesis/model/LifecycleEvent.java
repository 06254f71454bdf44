package com.anamnesis.model;

public record LifecycleEvent(LifecycleState state, double timestamp) {
    public LifecycleEvent {
        if (state == null) {
            throw new IllegalArgumentException("lifecycle event requires a state");
        }
    }
}
