package com.example.contractlens.infrastructure;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "contract-lens")
public class ContractLensProperties {
    private Semantic semantic = new Semantic();
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Semantic {
        private boolean enabled;
        private String apiKey;
        private String baseUrl = "https://api.anthropic.com";
        private String model = "claude-sonnet-4-5-20250929";
        private int maxTokens = 8192;
        private Duration timeout = Duration.ofSeconds(45);
        /** Characters of each source sent along with the change list. */
        private int sourceExcerptChars = 8000;
    }

    @Getter
    @Setter
    public static class Cache {
        private Duration ttl = Duration.ofDays(7);
        private int maxEntries = 500;
    }
}
