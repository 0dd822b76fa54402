package com.cumulo.service.core.config;

import com.cumulo.service.core.reduced.ReducedMetric;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cumulo")
public class CumuloProperties {
    private History history = new History();
    private Bitset bitset = new Bitset();
    private Window window = new Window();
    private Job job = new Job();
    private Reduced reduced = new Reduced();

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Bitset getBitset() {
        return bitset;
    }

    public void setBitset(Bitset bitset) {
        this.bitset = bitset;
    }

    public Window getWindow() {
        return window;
    }

    public void setWindow(Window window) {
        this.window = window;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Reduced getReduced() {
        return reduced;
    }

    public void setReduced(Reduced reduced) {
        this.reduced = reduced;
    }

    public static class History {
        private String format = "DATE_LIST";

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }
    }

    public static class Bitset {
        private int width = 32;

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }
    }

    public static class Window {
        private int monthlyDays = 28;

        public int getMonthlyDays() {
            return monthlyDays;
        }

        public void setMonthlyDays(int monthlyDays) {
            this.monthlyDays = monthlyDays;
        }
    }

    public static class Job {
        private boolean enabled = true;
        private String cron = "0 30 0 * * *";
        private String zone = "UTC";
        private int workers = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = Math.max(1, workers);
        }
    }

    public static class Reduced {
        private List<String> metrics = new ArrayList<>(List.of("event_count", "active_dimensions"));

        public List<String> getMetrics() {
            return metrics;
        }

        public void setMetrics(List<String> metrics) {
            this.metrics = metrics == null ? new ArrayList<>() : new ArrayList<>(metrics);
        }

        public List<ReducedMetric> resolvedMetrics() {
            return metrics.stream().map(ReducedMetric::fromConfigValue).distinct().toList();
        }
    }
}
