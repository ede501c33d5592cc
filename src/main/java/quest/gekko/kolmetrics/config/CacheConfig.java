package quest.gekko.kolmetrics.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Only profile media is cached. Tweet and profile metrics must always reach a provider,
 * so no other cache name is registered and dynamic creation is switched off.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String PROFILE_MEDIA = "profileMedia";

    private static final Duration PROFILE_MEDIA_TTL = Duration.ofMinutes(15);

    @Bean
    public CacheManager cacheManager() {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setAllowNullValues(false);
        cacheManager.setCacheNames(List.of());
        cacheManager.registerCustomCache(PROFILE_MEDIA, Caffeine.newBuilder()
                .maximumSize(2_000)
                .expireAfterWrite(PROFILE_MEDIA_TTL)
                .build());
        return cacheManager;
    }
}
