package quest.gekko.kolmetrics.service.core;

import quest.gekko.kolmetrics.service.integration.provider.ProviderKind;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;

import java.util.List;

public record KolSearchResult(String handle, boolean success, List<ScrapedTweet> tweets, String error,
                              ProviderKind provider) {

    static KolSearchResult found(final String handle, final List<ScrapedTweet> tweets, final ProviderKind provider) {
        return new KolSearchResult(handle, true, tweets, null, provider);
    }

    static KolSearchResult failed(final String handle, final String error) {
        return new KolSearchResult(handle, false, List.of(), error, null);
    }
}
