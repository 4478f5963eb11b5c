package com.verdict.core.hooks;

/**
 * {@link #EACH} hooks run around every example; {@link #ALL} hooks run once per group.
 */
public enum HookScope {
    EACH,
    ALL
}
