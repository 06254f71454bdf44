package com.anamnesis.model;

public record LifecycleTransition(LifecycleState from, LifecycleState to) {

    @Override
    public String toString() {
        return from + "->" + to;
    }
}
