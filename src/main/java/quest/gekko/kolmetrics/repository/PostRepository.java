package quest.gekko.kolmetrics.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.kolmetrics.domain.Post;
import quest.gekko.kolmetrics.domain.PostStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PostRepository extends JpaRepository<Post, Long> {
    Optional<Post> findByIdAndCampaignAgencyId(final Long id, final Long agencyId);

    @Query("""
        select p from Post p
        where p.status in :statuses
          and p.postedAt >= :since
          and p.tweetUrl is not null
        order by p.id
        """)
    List<Post> findDueForRefresh(@Param("statuses") final Collection<PostStatus> statuses,
                                 @Param("since") final Instant since);

    @Query("""
        select p from Post p
        where p.campaign.id = :campaignId
          and p.status in :statuses
          and p.tweetUrl is not null
        order by p.id
        """)
    List<Post> findRefreshableByCampaign(@Param("campaignId") final Long campaignId,
                                         @Param("statuses") final Collection<PostStatus> statuses);

    boolean existsByCampaignIdAndTweetId(final Long campaignId, final String tweetId);

    @Query("select p.tweetUrl from Post p where p.campaign.id = :campaignId and p.tweetUrl is not null")
    List<String> findTweetUrlsByCampaignId(@Param("campaignId") final Long campaignId);

    @Query("select p.tweetId from Post p where p.campaign.id = :campaignId and p.tweetId is not null")
    List<String> findTweetIdsByCampaignId(@Param("campaignId") final Long campaignId);

    @Query("""
        select new quest.gekko.kolmetrics.repository.PostAverages(
               avg(p.likes), avg(p.retweets), avg(p.replies), avg(p.impressions), count(p))
        from Post p
        where p.kol.id = :kolId and p.status in :statuses
        """)
    PostAverages averagesForKol(@Param("kolId") final Long kolId,
                                @Param("statuses") final Collection<PostStatus> statuses);
}
