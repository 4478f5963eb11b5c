package com.verdict.core.warnings;

import com.verdict.core.example.CurrentExample;
import com.verdict.core.example.Example;
import com.verdict.core.reporter.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Deprecation and warning notices raised by the framework on behalf of user code.
 */
public class Warnings {

    private static final Logger log = LoggerFactory.getLogger(Warnings.class);

    private final Reporter reporter;
    private final Consumer<String> sink;
    private final CallerFilter callerFilter;

    /**
     * @param reporter receives deprecations; when {@code null} they are only logged
     */
    public Warnings(Reporter reporter) {
        this(reporter, message -> log.warn("{}", message), CallerFilter.framework());
    }

    public Warnings(Reporter reporter, Consumer<String> sink, CallerFilter callerFilter) {
        this.reporter = reporter;
        this.sink = sink;
        this.callerFilter = callerFilter;
    }

    public void deprecate(String deprecated) {
        deprecate(deprecated, Map.of());
    }

    /**
     * Reports use of a deprecated feature. {@code data} may add fields (e.g. "replacement")
     * and may override the resolved "callSite".
     */
    public void deprecate(String deprecated, Map<String, Object> data) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("deprecated", deprecated);
        fields.put("callSite", callerFilter.firstNonFrameworkLine());
        fields.putAll(data);
        report(fields);
    }

    public void warnDeprecation(String message) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("message", message);
        report(fields);
    }

    public void warnWith(String message) {
        warnWith(message, WarnOptions.defaults());
    }

    public void warnWith(String message, WarnOptions options) {
        var warning = new StringBuilder(message);
        if (options.specLocation()) {
            if (!message.endsWith(".")) {
                warning.append('.');
            }
            Example current = CurrentExample.get();
            if (current == null) {
                warning.append(" Verdict could not determine which call generated this warning.");
            } else {
                warning.append(" Warning generated from spec at `").append(current.location()).append("`.");
            }
        }
        String callSite = options.resolveCallSite() ? callerFilter.firstNonFrameworkLine() : options.callSite();
        if (callSite != null) {
            warning.append(" Called from ").append(callSite).append('.');
        }
        sink.accept(warning.toString());
    }

    private void report(Map<String, Object> fields) {
        if (reporter == null) {
            log.warn("Deprecation outside of a run: {}", fields);
            return;
        }
        reporter.deprecation(fields);
    }
}
