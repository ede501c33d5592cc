package quest.gekko.kolmetrics.service.integration.provider;

import java.util.Comparator;
import java.util.List;

/** The registered providers sorted by {@link ProviderKind} precedence. */
public class ProviderChain {
    private final List<TwitterDataProvider> providers;

    public ProviderChain(final List<TwitterDataProvider> providers) {
        this.providers = providers.stream()
                .sorted(Comparator.comparing(TwitterDataProvider::kind))
                .toList();
    }

    public List<TwitterDataProvider> all() {
        return providers;
    }

    public List<TwitterDataProvider> profileCapable() {
        return providers.stream().filter(TwitterDataProvider::supportsProfiles).toList();
    }

    public List<TwitterDataProvider> searchCapable() {
        return providers.stream().filter(TwitterDataProvider::supportsSearch).toList();
    }
}
