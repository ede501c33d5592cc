package quest.gekko.kolmetrics.web.dto;

import java.util.List;

public record ScrapeResponse(boolean success,
                             List<KolScrapeResult> results,
                             List<AnnotatedTweet> tweets,
                             int totalScraped,
                             int imported,
                             List<String> keywords,
                             Debug debug,
                             String importError) {

    public record Debug(boolean apiKeyConfigured, String apiKeySource) {}
}
