package quest.gekko.kolmetrics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.kolmetrics.service.integration.provider.ProviderChain;
import quest.gekko.kolmetrics.service.integration.provider.TwitterDataProvider;

import java.util.List;

@Configuration
public class ConnectorConfig {

    @Bean
    public ProviderChain providerChain(List<TwitterDataProvider> providers) {
        return new ProviderChain(providers);
    }
}
