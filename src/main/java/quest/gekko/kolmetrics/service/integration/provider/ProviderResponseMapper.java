package quest.gekko.kolmetrics.service.integration.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw provider payloads onto {@link ScrapedTweet} and {@link ScrapedProfile}.
 * <p>
 * Each provider gets its own field table. Every canonical field lists the payload paths to try,
 * in order; the first present, non-null value wins. Counters that are absent or null become 0,
 * so "not reported" and "zero" are indistinguishable after mapping. Impressions are taken from
 * the provider's view count.
 */
@Component
public class ProviderResponseMapper {

    private static final DateTimeFormatter TWITTER_DATE =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);
    private static final List<DateTimeFormatter> DATE_FORMATS =
            List.of(DateTimeFormatter.ISO_OFFSET_DATE_TIME, TWITTER_DATE);

    record TweetFields(List<String> id,
                       List<String> text,
                       List<String> url,
                       List<String> authorHandle,
                       List<String> authorName,
                       List<String> createdAt,
                       List<String> views,
                       List<String> likes,
                       List<String> retweets,
                       List<String> replies,
                       List<String> quotes,
                       List<String> bookmarks,
                       List<String> retweetFlag,
                       List<String> quoteFlag,
                       List<String> replyFlag,
                       List<String> media) {}

    record ProfileFields(List<String> handle,
                         List<String> name,
                         List<String> followers,
                         List<String> following,
                         List<String> avatar,
                         List<String> banner) {}

    private static final Map<ProviderKind, TweetFields> TWEET_FIELDS = new EnumMap<>(ProviderKind.class);
    private static final Map<ProviderKind, ProfileFields> PROFILE_FIELDS = new EnumMap<>(ProviderKind.class);

    static {
        TWEET_FIELDS.put(ProviderKind.SOCIALDATA, new TweetFields(
                List.of("id_str", "id"),
                List.of("full_text", "text"),
                List.of(),
                List.of("user.screen_name"),
                List.of("user.name"),
                List.of("tweet_created_at", "created_at"),
                List.of("views_count", "views.count"),
                List.of("favorite_count"),
                List.of("retweet_count"),
                List.of("reply_count"),
                List.of("quote_count"),
                List.of("bookmark_count"),
                List.of("retweeted_status"),
                List.of("is_quote_status"),
                List.of("in_reply_to_status_id_str"),
                List.of("extended_entities.media", "entities.media")));

        TWEET_FIELDS.put(ProviderKind.APIFY, new TweetFields(
                List.of("id", "id_str"),
                List.of("text", "full_text", "content"),
                List.of("url", "twitterUrl"),
                List.of("author.userName"),
                List.of("author.name"),
                List.of("createdAt", "created_at"),
                List.of("viewCount", "view_count"),
                List.of("likeCount", "favorite_count"),
                List.of("retweetCount", "retweet_count"),
                List.of("replyCount", "reply_count"),
                List.of("quoteCount", "quote_count"),
                List.of("bookmarkCount", "bookmark_count"),
                List.of("isRetweet"),
                List.of("isQuote", "is_quote_status"),
                List.of("isReply"),
                List.of("extendedEntities.media", "media")));

        // no bookmarks, no retweet/quote flags
        TWEET_FIELDS.put(ProviderKind.SYNDICATION, new TweetFields(
                List.of("id_str"),
                List.of("text"),
                List.of(),
                List.of("user.screen_name"),
                List.of("user.name"),
                List.of("created_at"),
                List.of("views.count", "views_count"),
                List.of("favorite_count"),
                List.of("retweet_count"),
                List.of("reply_count"),
                List.of("quote_count"),
                List.of(),
                List.of(),
                List.of(),
                List.of("in_reply_to_status_id_str"),
                List.of("mediaDetails")));

        PROFILE_FIELDS.put(ProviderKind.SOCIALDATA, new ProfileFields(
                List.of("screen_name"),
                List.of("name"),
                List.of("followers_count"),
                List.of("friends_count"),
                List.of("profile_image_url_https"),
                List.of("profile_banner_url")));

        PROFILE_FIELDS.put(ProviderKind.APIFY, new ProfileFields(
                List.of("userName"),
                List.of("name"),
                List.of("followers"),
                List.of("following"),
                List.of("profilePicture"),
                List.of("coverPicture", "profileBannerUrl")));
    }

    /** Empty when the payload carries no tweet text. */
    public Optional<ScrapedTweet> toTweet(final ProviderKind provider, final JsonNode node, final String fallbackId) {
        final TweetFields f = TWEET_FIELDS.get(provider);
        if (f == null || node == null || node.isMissingNode() || node.isNull()) return Optional.empty();

        final String content = text(node, f.text());
        if (content == null || content.isEmpty()) return Optional.empty();

        final String id = Optional.ofNullable(text(node, f.id())).orElse(fallbackId);
        if (id == null || id.isBlank() || "-1".equals(id)) return Optional.empty();

        final String url = text(node, f.url());
        String handle = text(node, f.authorHandle());
        if (handle == null && url != null) handle = handleFromUrl(url);
        if (handle == null) handle = "";

        final TweetMetrics metrics = new TweetMetrics(
                number(node, f.views()),
                number(node, f.likes()),
                number(node, f.retweets()),
                number(node, f.replies()),
                number(node, f.quotes()),
                number(node, f.bookmarks()));

        return Optional.of(new ScrapedTweet(
                id,
                url != null ? url : canonicalUrl(handle, id),
                content,
                handle,
                Optional.ofNullable(text(node, f.authorName())).orElse(handle),
                timestamp(text(node, f.createdAt())),
                flag(node, f.retweetFlag()),
                flag(node, f.quoteFlag()),
                metrics,
                mediaUrls(node, f.media())));
    }

    public ScrapedProfile toProfile(final ProviderKind provider, final JsonNode node, final String fallbackHandle) {
        final ProfileFields f = PROFILE_FIELDS.get(provider);
        if (f == null) throw new IllegalArgumentException(provider + " has no profile mapping");
        final String handle = Optional.ofNullable(text(node, f.handle())).orElse(fallbackHandle);
        return new ScrapedProfile(
                handle,
                Optional.ofNullable(text(node, f.name())).orElse(handle),
                number(node, f.followers()),
                number(node, f.following()),
                upscaleAvatar(text(node, f.avatar())),
                text(node, f.banner()));
    }

    /** Retweets, and replies addressed to someone other than {@code handle}. */
    public boolean isRetweetOrForeignReply(final ProviderKind provider, final JsonNode node, final String content,
                                           final String handle) {
        if (content.startsWith("RT @")) return true;
        if (handle == null || handle.isBlank()) return false;
        final TweetFields f = TWEET_FIELDS.get(provider);
        final boolean ownReply = content.regionMatches(true, 0, "@" + handle, 0, handle.length() + 1);
        if (flag(node, f.replyFlag()) && !ownReply) return true;
        return content.startsWith("@") && !ownReply;
    }

    public static String canonicalUrl(final String handle, final String tweetId) {
        return "https://x.com/" + (handle == null || handle.isBlank() ? "i" : handle) + "/status/" + tweetId;
    }

    static String upscaleAvatar(final String url) {
        return url == null ? null : url.replace("_normal", "_400x400");
    }

    static Instant timestamp(final String raw) {
        if (raw == null || raw.isBlank()) return Instant.now();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return ZonedDateTime.parse(raw, format).toInstant();
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return Instant.now();
    }

    private static JsonNode at(final JsonNode node, final String path) {
        JsonNode current = node;
        for (String part : path.split("\\.")) {
            current = current.path(part);
        }
        return current;
    }

    private static JsonNode first(final JsonNode node, final List<String> paths) {
        for (String path : paths) {
            final JsonNode value = at(node, path);
            if (!value.isMissingNode() && !value.isNull()) return value;
        }
        return null;
    }

    private static String text(final JsonNode node, final List<String> paths) {
        final JsonNode value = first(node, paths);
        if (value == null || value.isContainerNode()) return null;
        final String s = value.asText();
        return s.isEmpty() ? null : s;
    }

    private static long number(final JsonNode node, final List<String> paths) {
        final JsonNode value = first(node, paths);
        if (value == null) return 0L;
        if (value.isNumber()) return value.asLong();
        try {
            return Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static boolean flag(final JsonNode node, final List<String> paths) {
        final JsonNode value = first(node, paths);
        if (value == null) return false;
        if (value.isBoolean()) return value.booleanValue();
        if (value.isContainerNode()) return value.size() > 0;
        return !value.asText().isEmpty();
    }

    private static List<String> mediaUrls(final JsonNode node, final List<String> paths) {
        final JsonNode media = first(node, paths);
        final List<String> urls = new ArrayList<>();
        if (media == null || !media.isArray()) return urls;
        for (JsonNode item : media) {
            final String url = text(item, List.of("media_url_https", "url"));
            if (url != null) urls.add(url);
        }
        return urls;
    }

    private static String handleFromUrl(final String url) {
        final int status = url.indexOf("/status");
        if (status < 0) return null;
        final int slash = url.lastIndexOf('/', status - 1);
        return slash < 0 ? null : url.substring(slash + 1, status);
    }
}
