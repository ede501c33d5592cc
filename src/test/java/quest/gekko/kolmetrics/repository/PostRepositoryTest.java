package quest.gekko.kolmetrics.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import quest.gekko.kolmetrics.domain.Campaign;
import quest.gekko.kolmetrics.domain.Kol;
import quest.gekko.kolmetrics.domain.Organization;
import quest.gekko.kolmetrics.domain.OrganizationType;
import quest.gekko.kolmetrics.domain.Post;
import quest.gekko.kolmetrics.domain.PostStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class PostRepositoryTest {

    private static final EnumSet<PostStatus> LIVE = EnumSet.of(PostStatus.POSTED, PostStatus.VERIFIED);

    @Autowired
    private TestEntityManager em;

    @Autowired
    private PostRepository postRepository;

    @Autowired
    private CampaignRepository campaignRepository;

    private Organization agency;
    private Organization client;
    private Campaign campaign;
    private Kol kol;

    @BeforeEach
    void setUp() {
        agency = organization("Agency", OrganizationType.AGENCY);
        client = organization("Client", OrganizationType.CLIENT);

        kol = new Kol();
        kol.setOrganization(agency);
        kol.setName("Alice");
        kol.setTwitterHandle("alice");
        em.persist(kol);

        campaign = new Campaign();
        campaign.setAgency(agency);
        campaign.setClient(client);
        campaign.setName("Launch");
        campaign.getKols().add(kol);
        em.persist(campaign);
    }

    private Organization organization(String name, OrganizationType type) {
        Organization org = new Organization();
        org.setName(name);
        org.setType(type);
        return em.persist(org);
    }

    private Post post(String tweetId, PostStatus status, Instant postedAt, long likes) {
        Post p = new Post();
        p.setCampaign(campaign);
        p.setKol(kol);
        p.setStatus(status);
        p.setTweetId(tweetId);
        p.setTweetUrl(tweetId == null ? null : "https://x.com/alice/status/" + tweetId);
        p.setPostedAt(postedAt);
        p.setLikes(likes);
        return em.persist(p);
    }

    @Test
    void findDueForRefresh_onlyRecentLivePostsWithUrl() {
        Instant now = Instant.now();
        Post recent = post("111", PostStatus.POSTED, now.minus(Duration.ofDays(2)), 10);
        post("222", PostStatus.POSTED, now.minus(Duration.ofDays(45)), 10);
        post("333", PostStatus.DRAFT, now.minus(Duration.ofDays(1)), 10);
        post(null, PostStatus.VERIFIED, now.minus(Duration.ofDays(1)), 10);
        em.flush();
        em.clear();

        List<Post> due = postRepository.findDueForRefresh(LIVE, now.minus(Duration.ofDays(30)));

        assertEquals(List.of(recent.getId()), due.stream().map(Post::getId).toList());
    }

    @Test
    void tweetLookups_supportDuplicateDetection() {
        post("111", PostStatus.POSTED, Instant.now(), 0);
        em.flush();

        assertTrue(postRepository.existsByCampaignIdAndTweetId(campaign.getId(), "111"));
        assertFalse(postRepository.existsByCampaignIdAndTweetId(campaign.getId(), "999"));
        assertEquals(List.of("111"), postRepository.findTweetIdsByCampaignId(campaign.getId()));
        assertEquals(List.of("https://x.com/alice/status/111"), postRepository.findTweetUrlsByCampaignId(campaign.getId()));
    }

    @Test
    void averagesForKol_countsOnlyMatchingStatuses() {
        post("111", PostStatus.POSTED, Instant.now(), 10);
        post("222", PostStatus.VERIFIED, Instant.now(), 30);
        post("333", PostStatus.DRAFT, Instant.now(), 1000);
        em.flush();

        PostAverages averages = postRepository.averagesForKol(kol.getId(), LIVE);

        assertEquals(2L, averages.postCount());
        assertEquals(20.0, averages.likes());
    }

    @Test
    void averagesForKol_withoutPostsHasNullAverages() {
        PostAverages averages = postRepository.averagesForKol(kol.getId(), LIVE);

        assertEquals(0L, averages.postCount());
        assertNull(averages.likes());
    }

    @Test
    void findWithKolsVisibleTo_agencyAndAttachedClientOnly() {
        em.flush();
        em.clear();
        Organization stranger = organization("Other", OrganizationType.AGENCY);

        assertEquals(1, campaignRepository.findWithKolsVisibleTo(campaign.getId(), agency.getId()).orElseThrow().getKols().size());
        assertTrue(campaignRepository.findWithKolsVisibleTo(campaign.getId(), client.getId()).isPresent());
        assertTrue(campaignRepository.findWithKolsVisibleTo(campaign.getId(), stranger.getId()).isEmpty());
        assertTrue(campaignRepository.findWithKolsByIdAndAgencyId(campaign.getId(), client.getId()).isEmpty());
    }
}
