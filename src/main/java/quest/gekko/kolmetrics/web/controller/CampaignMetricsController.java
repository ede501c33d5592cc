package quest.gekko.kolmetrics.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.kolmetrics.service.core.CampaignMediaService;
import quest.gekko.kolmetrics.service.core.PostMetricsService;
import quest.gekko.kolmetrics.web.dto.MediaRefreshResult;
import quest.gekko.kolmetrics.web.security.TenantSessionResolver;

import java.security.Principal;

@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
public class CampaignMetricsController {
    private final PostMetricsService postMetricsService;
    private final CampaignMediaService mediaService;
    private final TenantSessionResolver sessions;

    @PostMapping("/{campaignId}/refresh-metrics")
    public PostMetricsService.CampaignRefreshResult refreshCampaign(@PathVariable Long campaignId, Principal principal) {
        return postMetricsService.refreshCampaign(sessions.requireAgency(principal).organizationId(), campaignId);
    }

    @PostMapping("/refresh-media")
    public MediaRefreshResult refreshMedia(@RequestParam(defaultValue = "false") boolean force, Principal principal) {
        return mediaService.refreshMedia(sessions.requireAgency(principal).organizationId(), force);
    }
}
