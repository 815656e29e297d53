package com.researchintel.deepresearch.config;

import com.researchintel.deepresearch.model.Depth;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "deep-research")
@Data
public class DeepResearchProperties {

    private String runsDir = "./runs";
    private String cacheDir = "./runs/.cache";
    private Defaults defaults = new Defaults();
    private Clarification clarification = new Clarification();
    private Fetch fetch = new Fetch();
    private Report report = new Report();
    private Runner runner = new Runner();

    /**
     * Run parameters used when neither the caller nor a persisted plan record supplies them.
     */
    @Data
    public static class Defaults {
        private int workers = 5;
        private Depth depth = Depth.MEDIUM;
        private int budget = 10;
        private String lang = "en";
    }

    @Data
    public static class Clarification {
        private int minTopicLength = 20;
        private int maxQuestions = 3;
    }

    @Data
    public static class Fetch {
        private FetchMode mode = FetchMode.SYNTHETIC;
        private Duration timeout = Duration.ofSeconds(30);

        public enum FetchMode {
            SYNTHETIC, HTTP
        }
    }

    @Data
    public static class Report {
        private String title = "Research Report";
    }

    @Data
    public static class Runner {
        private boolean enabled = true;
    }
}
