package com.dispatchplatform.ingestion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Everything the worker reads from {@code dispatch.ingestion.*}. */
@Data
@ConfigurationProperties(prefix = "dispatch.ingestion")
public class IngestionProperties {

    /** City ids to ingest. Each must have a built-in profile. */
    private List<String> cities = new ArrayList<>(List.of("nyc", "mpls"));

    private Streams streams = new Streams();
    private Calls calls = new Calls();
    private OpenMhz openMhz = new OpenMhz();
    private Speech speech = new Speech();
    private Cameras cameras = new Cameras();
    private State state = new State();
    private Snapshot snapshot = new Snapshot();

    @Data
    public static class Streams {
        private boolean enabled = true;
        private String baseUrl = "https://audio.broadcastify.com";
        private String username = "";
        private String password = "";
        private int maxConcurrent = 4;
        private Duration chunkDuration = Duration.ofSeconds(15);
        private int minChunkBytes = 5000;
        private Duration livenessInterval = Duration.ofSeconds(30);
        private Duration silenceThreshold = Duration.ofSeconds(90);
        private Duration reconnectDelay = Duration.ofSeconds(3);
        private Duration errorReconnectDelay = Duration.ofSeconds(5);
        private Duration connectStagger = Duration.ofSeconds(2);
        private Duration dropCooldown = Duration.ofMinutes(5);
        private List<Feed> feeds = new ArrayList<>();
    }

    @Data
    public static class Feed {
        private String id;
        private String name;
        private String city;
    }

    @Data
    public static class Calls {
        private boolean enabled = false;
        private String baseUrl = "https://api.bcfy.io";
        private String apiKeyId = "";
        private String apiKeySecret = "";
        private String appId = "";
        private String username = "";
        private String password = "";
        private String systemId = "7636";
        private String city = "nyc";
        private Duration interval = Duration.ofSeconds(30);
        private Duration initialDelay = Duration.ofSeconds(10);
        private Duration sessionTtl = Duration.ofHours(1);
        private Duration tokenTtl = Duration.ofHours(1);
        private int maxConsecutiveFailures = 5;
        private int minAudioBytes = 1000;
        private Duration downloadTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class OpenMhz {
        private boolean enabled = true;
        private String baseUrl = "https://api.openmhz.com";
        private Duration interval = Duration.ofSeconds(10);
        private Duration lookback = Duration.ofMinutes(5);
        private int maxCallsPerPoll = 10;
        private int maxConsecutiveFailures = 5;
    }

    @Data
    public static class Speech {
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";
        private String model = "whisper-1";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Cameras {
        private String nycApiUrl = "https://webcams.nyctmc.org/api/cameras";
        /** Static cameras per city id, used when the city has no camera API or it is unreachable. */
        private Map<String, List<CameraEntry>> fallback = new HashMap<>();
    }

    @Data
    public static class CameraEntry {
        private String id;
        private String location;
        private String area;
        private double lat;
        private double lng;
        private String imageUrl;
    }

    @Data
    public static class State {
        private int incidentRing = 50;
        private int transcriptRing = 20;
        private int callDedupCapacity = 1000;
        private int transcriptDedupCapacity = 100;
    }

    @Data
    public static class Snapshot {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(10);
        private Duration ttl = Duration.ofSeconds(300);
        private int recentIncidents = 20;
    }
}
