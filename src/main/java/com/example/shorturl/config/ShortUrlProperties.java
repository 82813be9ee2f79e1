package com.example.shorturl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "app")
public class ShortUrlProperties {

    /** Public origin used to build short and QR links. */
    private String baseUrl = "http://localhost:8080";

    /** API keys accepted in the {@code X-API-Key} header; each key owns the URLs it creates. */
    private List<String> apiKeys = new ArrayList<>();

    private int maxUrlLength = 2048;
    private int maxDescriptionLength = 255;

    private Id id = new Id();
    private Cache cache = new Cache();
    private Qr qr = new Qr();
    private RateLimit rateLimit = new RateLimit();
    private Sweep sweep = new Sweep();
    private ClickEvents clickEvents = new ClickEvents();
    private Cors cors = new Cors();
    private Background background = new Background();

    @Data
    public static class Id {
        private int length = 6;
        /** Rounds of generate-and-check before random allocation gives up. */
        private int maxAttempts = 10;
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration reEvictDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Qr {
        private String generatorUrl = "https://api.qrserver.com/v1/create-qr-code/";
        private int defaultSize = 200;
        private int minSize = 50;
        private int maxSize = 1000;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int requestsPerWindow = 60;
        private Duration window = Duration.ofMinutes(1);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private String cron = "0 */10 * * * *";
    }

    @Data
    public static class ClickEvents {
        private boolean enabled = true;
        private Duration retention = Duration.ofDays(180);
        private String purgeCron = "0 30 3 * * *";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://localhost:8080"));
    }

    @Data
    public static class Background {
        private int corePoolSize = 2;
        private int maxPoolSize = 8;
        private int queueCapacity = 1000;
    }
}
