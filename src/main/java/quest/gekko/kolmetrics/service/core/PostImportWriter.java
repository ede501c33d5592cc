package quest.gekko.kolmetrics.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.kolmetrics.domain.Post;
import quest.gekko.kolmetrics.domain.PostStatus;
import quest.gekko.kolmetrics.domain.PostType;
import quest.gekko.kolmetrics.repository.CampaignRepository;
import quest.gekko.kolmetrics.repository.KolRepository;
import quest.gekko.kolmetrics.repository.PostRepository;
import quest.gekko.kolmetrics.service.integration.provider.ScrapedTweet;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts one auto-imported post per transaction, so a unique-key collision with a concurrent
 * writer only loses that row. Callers treat {@code DataIntegrityViolationException} as
 * "already imported".
 */
@Component
@RequiredArgsConstructor
public class PostImportWriter {
    private final PostRepository postRepository;
    private final CampaignRepository campaignRepository;
    private final KolRepository kolRepository;

    /** @return false when the campaign already has a post for this tweet id */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean insert(final Long campaignId, final Long kolId, final ScrapedTweet tweet,
                          final List<String> matchedKeywords) {
        if (postRepository.existsByCampaignIdAndTweetId(campaignId, tweet.id())) return false;

        final Post post = new Post();
        post.setCampaign(campaignRepository.getReferenceById(campaignId));
        post.setKol(kolRepository.getReferenceById(kolId));
        post.setType(typeOf(tweet));
        post.setStatus(PostStatus.POSTED);
        post.setContent(tweet.content());
        post.setTweetId(tweet.id());
        post.setTweetUrl(tweet.url());
        post.setPostedAt(tweet.postedAt());
        post.setImpressions(tweet.metrics().views());
        post.setLikes(tweet.metrics().likes());
        post.setRetweets(tweet.metrics().retweets());
        post.setReplies(tweet.metrics().replies());
        post.setQuotes(tweet.metrics().quotes());
        post.setBookmarks(tweet.metrics().bookmarks());
        post.setMatchedKeywords(new ArrayList<>(matchedKeywords));
        post.setHasKeywordMatch(!matchedKeywords.isEmpty());
        postRepository.saveAndFlush(post);
        return true;
    }

    static PostType typeOf(final ScrapedTweet tweet) {
        if (tweet.retweet()) return PostType.RETWEET;
        if (tweet.quote()) return PostType.QUOTE;
        return PostType.POST;
    }
}
