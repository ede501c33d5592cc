package quest.gekko.kolmetrics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the metrics pipeline
 */
@Configuration
@EnableConfigurationProperties({
        KolProperties.Providers.class,
        KolProperties.Refresh.class,
        KolProperties.Scrape.class,
        KolProperties.Cron.class,
        KolProperties.Crypto.class
})
public class KolProperties {

    @ConfigurationProperties("kol.providers")
    public record Providers(@DefaultValue SocialData socialdata,
                            @DefaultValue Apify apify,
                            @DefaultValue Syndication syndication,
                            @DefaultValue("5") int maxConcurrentCalls,
                            @DefaultValue("3") int maxAttempts,
                            @DefaultValue("800ms") Duration initialBackoff,
                            @DefaultValue("10s") Duration maxBackoff,
                            @DefaultValue("10s") Duration connectTimeout,
                            @DefaultValue("30s") Duration readTimeout) {}

    public record SocialData(@DefaultValue("https://api.socialdata.tools") String baseUrl,
                             @DefaultValue("15s") Duration timeout,
                             @DefaultValue("500ms") Duration pageDelay) {}

    public record Apify(@DefaultValue("https://api.apify.com") String baseUrl,
                        @DefaultValue("CJdippxWmn9uRfooo") String actorId,
                        @DefaultValue("2s") Duration pollInterval,
                        @DefaultValue("60s") Duration pollTimeout,
                        @DefaultValue("15s") Duration timeout) {}

    public record Syndication(@DefaultValue("https://cdn.syndication.twimg.com") String baseUrl,
                              @DefaultValue("10s") Duration timeout) {}

    @ConfigurationProperties("kol.refresh")
    public record Refresh(@DefaultValue("10") int postBatchSize,
                          @DefaultValue("10") int kolBatchSize,
                          @DefaultValue("5") int refreshAllBatchSize,
                          @DefaultValue("1s") Duration batchDelay,
                          @DefaultValue("500ms") Duration campaignPostDelay,
                          @DefaultValue("30d") Duration postWindow,
                          @DefaultValue("1h") Duration postCooldown,
                          Long credentialOrganizationId,
                          @DefaultValue("false") boolean scheduleEnabled,
                          @DefaultValue("0 0 */6 * * *") String cron) {}

    @ConfigurationProperties("kol.scrape")
    public record Scrape(@DefaultValue("30") int maxTweetsPerKol,
                         @DefaultValue("3s") Duration kolDelay) {}

    @ConfigurationProperties("kol.cron")
    public record Cron(String secret) {}

    @ConfigurationProperties("kol.crypto")
    public record Crypto(String encryptionKey) {}
}
