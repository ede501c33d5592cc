package quest.gekko.kolmetrics.web.dto;

import java.util.List;

public record ScrapeInfo(Long campaignId, List<String> keywords, List<KolSummary> kols, boolean scraperAvailable) {
}
