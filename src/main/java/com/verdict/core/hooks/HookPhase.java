package com.verdict.core.hooks;

public enum HookPhase {
    BEFORE,
    AFTER,
    AROUND
}
