package com.z254.gridpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for GRIDPULSE service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "gridpulse")
public class GridPulseProperties {

    private StorageProperties storage = new StorageProperties();
    private SessionProperties session = new SessionProperties();
    private EventProperties events = new EventProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private SignalProperties signal = new SignalProperties();
    private InfluenceProperties influence = new InfluenceProperties();
    private LlmProperties llm = new LlmProperties();
    private WeatherProperties weather = new WeatherProperties();
    private SearchProperties search = new SearchProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();

    public enum StorageType {
        REDIS,
        MEMORY
    }

    @Data
    public static class StorageProperties {
        private StorageType type = StorageType.REDIS;
    }

    @Data
    public static class SessionProperties {
        private String redisKeyPrefix = "gridpulse:session:";
        private Duration ttl = Duration.ofHours(24);
        private int historyLimit = 20;
    }

    @Data
    public static class EventProperties {
        private String redisKeyPrefix = "gridpulse:events:";
        private int maxLogLength = 1000;
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class PipelineProperties {
        private Duration classifierTimeout = Duration.ofSeconds(60);
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private Duration forecasterTimeout = Duration.ofSeconds(60);
        private Duration narratorChunkTimeout = Duration.ofSeconds(120);
        private int enrichmentConcurrency = 5;
        private int blockingPoolSize = 8;
        private int blockingQueueSize = 256;
        private int defaultHistoryDays = 60;
        private int minHistoryDays = 30;
        private int maxHistoryDays = 92;
        private int defaultHorizon = 30;
        private int maxHorizon = 90;
        private int contextDays = 30;
    }

    @Data
    public static class SignalProperties {
        private ChangePointProperties changePoint = new ChangePointProperties();
        private ZoneProperties zones = new ZoneProperties();

        @Data
        public static class ChangePointProperties {
            private int window = 5;
            private double historyThreshold = 1.3;
            private double forecastThreshold = 1.2;
            private int topN = 5;
            private int neighborhood = 2;
            private boolean fallbackEnabled = true;
        }

        @Data
        public static class ZoneProperties {
            private int lookback = 60;
            private int maxZoneLength = 10;
            private int volumeWindow = 20;
            private int fallbackTopK = 2;
            private int maxZones = 10;
            private boolean fallbackEnabled = true;
        }
    }

    @Data
    public static class InfluenceProperties {
        private int minPoints = 10;
        private int windowSize = 14;
        private int windowStep = 7;
        private double minFactorChangePct = 5.0;
        private double defaultStructureRatio = 0.3;
        // Secondary-industry share of regional GDP, keyed by region code
        private Map<String, Double> structureRatios = new HashMap<>();
    }

    @Data
    public static class LlmProperties {
        private boolean enabled = false;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private int maxTokens = 2048;
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class WeatherProperties {
        private String baseUrl = "https://api.open-meteo.com/v1";
        private Duration timeout = Duration.ofSeconds(30);
        private String timezone = "Asia/Shanghai";
    }

    @Data
    public static class SearchProperties {
        private boolean enabled = false;
        private String baseUrl = "https://api.tavily.com";
        private String apiKey;
        private int maxResults = 10;
        private Duration timeout = Duration.ofSeconds(20);
    }

    /**
     * Report index: a Qdrant collection of report chunks searched by dense vector.
     * Embeddings come from an OpenAI-compatible endpoint; it defaults to the LLM one.
     */
    @Data
    public static class RetrievalProperties {
        private boolean enabled = false;
        private String qdrantUrl = "http://localhost:6333";
        private String qdrantApiKey;
        private String collection = "energy_reports";
        private String vectorName = "dense";
        private int topK = 5;
        private double scoreThreshold = 0.0;
        private String embeddingBaseUrl;
        private String embeddingApiKey;
        private String embeddingModel = "BAAI/bge-m3";
        private Duration timeout = Duration.ofSeconds(20);
    }
}
