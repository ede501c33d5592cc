package quest.gekko.kolmetrics.service.core;

public record KolRefreshOutcome(Long kolId,
                                String handle,
                                boolean profileUpdated,
                                Long followersCount,
                                Long followersChange,
                                long avgLikes,
                                long avgRetweets,
                                long avgReplies,
                                double avgEngagementRate,
                                long postsAnalyzed,
                                String error) {
}
