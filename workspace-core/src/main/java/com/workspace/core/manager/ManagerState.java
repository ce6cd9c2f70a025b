package com.workspace.core.manager;

public enum ManagerState {
    DECIDING,
    ACTING,
    DONE
}
