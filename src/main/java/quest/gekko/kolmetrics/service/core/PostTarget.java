package quest.gekko.kolmetrics.service.core;

import quest.gekko.kolmetrics.domain.Post;
import quest.gekko.kolmetrics.util.TweetIdentifiers;

/** Detached view of a post to refresh; safe to hand to batch worker threads. */
public record PostTarget(Long postId, String tweetUrl) {
    public static PostTarget of(final Post post) {
        final String url = post.getTweetUrl();
        // a parseable URL carries the author handle some providers need; short links do not
        if (url != null && TweetIdentifiers.parse(url).isPresent()) return new PostTarget(post.getId(), url);
        return new PostTarget(post.getId(), post.getTweetId() != null ? post.getTweetId() : url);
    }

    @Override
    public String toString() {
        return "post " + postId;
    }
}
