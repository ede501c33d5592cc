package quest.gekko.kolmetrics.service.credentials;

import lombok.Builder;
import quest.gekko.kolmetrics.service.integration.provider.ProviderKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Decrypted provider credentials for one pipeline invocation. Passed explicitly to every
 * provider call; nothing holds keys between invocations. Closing drops the references, after
 * which the context reports itself unconfigured.
 */
public final class CredentialContext implements AutoCloseable {
    private static final CredentialContext UNCONFIGURED = new CredentialContext(null, null, null, null, null, null);

    private final Long organizationId;
    private volatile String socialDataApiKey;
    private volatile String apifyApiKey;
    private volatile String twitterApiKey;
    private volatile String twitterCookies;
    private volatile String twitterCsrfToken;

    @Builder
    private CredentialContext(final Long organizationId, final String socialDataApiKey, final String apifyApiKey,
                              final String twitterApiKey, final String twitterCookies, final String twitterCsrfToken) {
        this.organizationId = organizationId;
        this.socialDataApiKey = blankToNull(socialDataApiKey);
        this.apifyApiKey = blankToNull(apifyApiKey);
        this.twitterApiKey = blankToNull(twitterApiKey);
        this.twitterCookies = blankToNull(twitterCookies);
        this.twitterCsrfToken = blankToNull(twitterCsrfToken);
    }

    public static CredentialContext unconfigured() {
        return UNCONFIGURED;
    }

    public Long organizationId() { return organizationId; }
    public String socialDataApiKey() { return socialDataApiKey; }
    public String apifyApiKey() { return apifyApiKey; }
    public String twitterApiKey() { return twitterApiKey; }
    public String twitterCookies() { return twitterCookies; }
    public String twitterCsrfToken() { return twitterCsrfToken; }

    public boolean isConfigured(final ProviderKind provider) {
        return switch (provider) {
            case SOCIALDATA -> socialDataApiKey != null;
            case APIFY -> apifyApiKey != null;
            case SYNDICATION -> true;
        };
    }

    /** True when the primary or the secondary provider has a key; the tertiary needs none. */
    public boolean hasAnyProviderConfigured() {
        return socialDataApiKey != null || apifyApiKey != null;
    }

    public List<ProviderKind> configuredProviders() {
        final List<ProviderKind> kinds = new ArrayList<>();
        for (ProviderKind kind : ProviderKind.values()) {
            if (kind.requiresCredentials() && isConfigured(kind)) kinds.add(kind);
        }
        return kinds;
    }

    /** "socialdata+apify", "apify" or "none"; safe to log and return to clients. */
    public String describeSource() {
        final List<ProviderKind> kinds = configuredProviders();
        if (kinds.isEmpty()) return "none";
        return String.join("+", kinds.stream().map(k -> k.name().toLowerCase()).toList());
    }

    @Override
    public void close() {
        socialDataApiKey = null;
        apifyApiKey = null;
        twitterApiKey = null;
        twitterCookies = null;
        twitterCsrfToken = null;
    }

    @Override
    public String toString() {
        return "CredentialContext[organization=" + organizationId + ", providers=" + describeSource() + "]";
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
