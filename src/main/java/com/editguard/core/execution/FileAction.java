package com.editguard.core.execution;

public enum FileAction {
    CREATE,
    MODIFY,
    DELETE
}
