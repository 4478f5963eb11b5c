package com.verdict.core.warnings;

/**
 * Options for {@link Warnings#warnWith(String, WarnOptions)}.
 *
 * @param specLocation    append the location of the running example
 * @param resolveCallSite look the call site up from the stack instead of using {@code callSite}
 * @param callSite        explicit call site; {@code null} omits it when not resolving
 */
public record WarnOptions(boolean specLocation, boolean resolveCallSite, String callSite) {

    public static WarnOptions defaults() {
        return new WarnOptions(false, true, null);
    }

    public WarnOptions withSpecLocation() {
        return new WarnOptions(true, resolveCallSite, callSite);
    }

    public WarnOptions withCallSite(String callSite) {
        return new WarnOptions(specLocation, false, callSite);
    }
}
