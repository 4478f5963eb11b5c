package com.verdict.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "verdict")
public class VerdictProperties implements RunConfiguration {

    private boolean dryRun = false;
    private boolean expectingMatcherDescriptions = true;
    private DescriptionFormat descriptionFormat = DescriptionFormat.AS_IS;
    private String runIdPrefix = "VRDT";

    @Override
    public boolean dryRun() { return dryRun; }

    @Override
    public boolean expectingMatcherDescriptions() { return expectingMatcherDescriptions; }

    @Override
    public String formatDescription(String description) {
        return descriptionFormat.apply(description);
    }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
    public boolean isExpectingMatcherDescriptions() { return expectingMatcherDescriptions; }
    public void setExpectingMatcherDescriptions(boolean expectingMatcherDescriptions) {
        this.expectingMatcherDescriptions = expectingMatcherDescriptions;
    }
    public DescriptionFormat getDescriptionFormat() { return descriptionFormat; }
    public void setDescriptionFormat(DescriptionFormat descriptionFormat) { this.descriptionFormat = descriptionFormat; }
    public String getRunIdPrefix() { return runIdPrefix; }
    public void setRunIdPrefix(String runIdPrefix) { this.runIdPrefix = runIdPrefix; }
}
