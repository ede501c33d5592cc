package quest.gekko.kolmetrics.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.kolmetrics.service.core.CampaignScrapeService;
import quest.gekko.kolmetrics.web.dto.ScrapeInfo;
import quest.gekko.kolmetrics.web.dto.ScrapeRequest;
import quest.gekko.kolmetrics.web.dto.ScrapeResponse;
import quest.gekko.kolmetrics.web.security.TenantSessionResolver;

import java.security.Principal;

@RestController
@RequestMapping("/api/campaigns/{campaignId}/scrape")
@RequiredArgsConstructor
public class CampaignScrapeController {
    private final CampaignScrapeService scrapeService;
    private final TenantSessionResolver sessions;

    @PostMapping
    public ScrapeResponse scrape(@PathVariable Long campaignId, @RequestBody ScrapeRequest request, Principal principal) {
        final Long orgId = sessions.requireAgency(principal).organizationId();
        return scrapeService.scrape(orgId, campaignId, request);
    }

    @GetMapping
    public ScrapeInfo info(@PathVariable Long campaignId, Principal principal) {
        return scrapeService.info(sessions.resolve(principal).organizationId(), campaignId);
    }
}
