package quest.gekko.kolmetrics.web.dto;

import java.util.List;

public record MediaRefreshResult(int total, int updated, int failed, List<CampaignMedia> results) {

    public record CampaignMedia(Long campaignId, String handle, String avatarUrl, String bannerUrl, String error) {}
}
