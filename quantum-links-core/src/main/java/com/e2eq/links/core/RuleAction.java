package com.e2eq.links.core;

public enum RuleAction {
    CREATE_TARGET,
    UPDATE_TARGET,
    DELETE_TARGET,
    PROPAGATE_STATUS
}
