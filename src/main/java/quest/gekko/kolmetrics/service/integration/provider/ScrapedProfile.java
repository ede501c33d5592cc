package quest.gekko.kolmetrics.service.integration.provider;

public record ScrapedProfile(String handle,
                             String name,
                             long followersCount,
                             long followingCount,
                             String avatarUrl,
                             String bannerUrl) {
}
