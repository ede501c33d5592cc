package quest.gekko.kolmetrics.service.integration.provider;

/** Providers in fallback precedence order. */
public enum ProviderKind {
    SOCIALDATA(true),
    APIFY(true),
    SYNDICATION(false);

    private final boolean requiresCredentials;

    ProviderKind(final boolean requiresCredentials) {
        this.requiresCredentials = requiresCredentials;
    }

    public boolean requiresCredentials() {
        return requiresCredentials;
    }
}
