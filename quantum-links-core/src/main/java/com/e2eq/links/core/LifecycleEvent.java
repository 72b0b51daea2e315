package com.e2eq.links.core;

public enum LifecycleEvent {
    CREATE,
    UPDATE,
    DELETE,
    COMPLETE
}
