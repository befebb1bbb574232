package com.dispatchplatform.bureau.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Everything the bureau reads from {@code dispatch.bureau.*}. */
@Data
@ConfigurationProperties(prefix = "dispatch.bureau")
public class BureauProperties {

    /** City ids to run an orchestrator for. Each must have a built-in profile. */
    private List<String> cities = new ArrayList<>(List.of("nyc", "mpls"));

    private Memory memory = new Memory();
    private Schedule schedule = new Schedule();
    private Pursuit pursuit = new Pursuit();
    private Historian historian = new Historian();
    private PatternSettings pattern = new PatternSettings();
    private Predictor predictor = new Predictor();
    private Query query = new Query();

    @Data
    public static class Memory {
        private int incidentRing = 200;
        private int patternCap = 50;
        private int placeCap = 500;
    }

    @Data
    public static class Schedule {
        private Duration predictorInterval = Duration.ofMinutes(15);
        private Duration predictorInitialDelay = Duration.ofMinutes(2);
        private Duration patternScanInterval = Duration.ofMinutes(5);
        private Duration predictionSweepInterval = Duration.ofMinutes(1);
        private Duration pursuitCooldownInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Pursuit {
        private Duration activeWindow = Duration.ofMinutes(30);
        private int maxTokens = 400;
    }

    @Data
    public static class Historian {
        private int maxTokens = 300;
    }

    @Data
    public static class PatternSettings {
        private Duration lookback = Duration.ofHours(24);
        private Duration validity = Duration.ofHours(6);
        private Duration predictionTtl = Duration.ofHours(6);
        private int minRelated = 2;
        private double similarityThreshold = 0.3;
        private double minPredictionConfidence = 0.5;
        private int deepScanMinIncidents = 10;
        private int deepScanWindow = 50;
        private int maxTokens = 500;
        private int deepScanMaxTokens = 800;
    }

    @Data
    public static class Predictor {
        private int minIncidents = 5;
        private int hotspotCount = 10;
        private int recentIncidents = 20;
        private int maxPredictions = 3;
        private Duration defaultWindow = Duration.ofMinutes(30);
        private Duration minWindow = Duration.ofMinutes(5);
        private Duration maxWindow = Duration.ofMinutes(360);
        private int maxTokens = 600;
    }

    @Data
    public static class Query {
        private int askMaxTokens = 500;
        private int briefingMaxTokens = 600;
        private int hotspotLimit = 50;
        private int recentPredictions = 20;
    }
}
