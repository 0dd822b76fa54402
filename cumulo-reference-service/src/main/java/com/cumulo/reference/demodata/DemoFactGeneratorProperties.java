package com.cumulo.reference.demodata;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component("demoFactGeneratorProperties")
@ConfigurationProperties(prefix = "demo-data.facts")
public class DemoFactGeneratorProperties {

    private boolean enabled;
    private Duration runEvery = Duration.ofMinutes(1);
    private int entityCount = 50;
    private String entityPrefix = "user-";
    private double activeRatio = 0.3;
    private int maxEventsPerFact = 20;
    private Long seed;
    private List<String> dimensions = new ArrayList<>(List.of("web", "mobile"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getRunEvery() {
        return runEvery;
    }

    public void setRunEvery(Duration runEvery) {
        this.runEvery = runEvery;
    }

    public int getEntityCount() {
        return entityCount;
    }

    public void setEntityCount(int entityCount) {
        this.entityCount = Math.max(0, entityCount);
    }

    public String getEntityPrefix() {
        return entityPrefix;
    }

    public void setEntityPrefix(String entityPrefix) {
        this.entityPrefix = entityPrefix;
    }

    public double getActiveRatio() {
        return activeRatio;
    }

    public void setActiveRatio(double activeRatio) {
        this.activeRatio = Math.max(0.0, Math.min(1.0, activeRatio));
    }

    public int getMaxEventsPerFact() {
        return maxEventsPerFact;
    }

    public void setMaxEventsPerFact(int maxEventsPerFact) {
        this.maxEventsPerFact = Math.max(1, maxEventsPerFact);
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    /** Empty means facts are written without a dimension. */
    public List<String> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<String> dimensions) {
        this.dimensions = dimensions == null ? new ArrayList<>() : new ArrayList<>(dimensions);
    }
}
