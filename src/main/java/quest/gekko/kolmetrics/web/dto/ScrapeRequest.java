package quest.gekko.kolmetrics.web.dto;

import java.util.List;

/**
 * {@code mode} is "all" (search the campaign's KOLs, optionally only {@code kolIds}) or
 * "single" (fetch the given {@code tweetUrls}).
 */
public record ScrapeRequest(String mode,
                            List<Long> kolIds,
                            List<String> tweetUrls,
                            Boolean autoImport,
                            List<String> filterKeywords) {

    public boolean manual() {
        return "single".equalsIgnoreCase(mode) && tweetUrls != null && !tweetUrls.isEmpty();
    }

    public boolean shouldImport() {
        return Boolean.TRUE.equals(autoImport);
    }
}
