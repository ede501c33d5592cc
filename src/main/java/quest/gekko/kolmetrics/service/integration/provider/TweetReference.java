package quest.gekko.kolmetrics.service.integration.provider;

/**
 * A canonical tweet id, plus the author handle when the input was a status URL.
 * The secondary provider can only look a tweet up when the handle is known.
 */
public record TweetReference(String tweetId, String authorHandle) {
    public boolean hasAuthorHandle() {
        return authorHandle != null && !authorHandle.isBlank();
    }
}
