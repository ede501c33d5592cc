package quest.gekko.kolmetrics.util;

import quest.gekko.kolmetrics.service.integration.provider.TweetReference;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical tweet ids from user input. Accepts a bare numeric id or a status URL on
 * twitter.com / x.com (with or without scheme, {@code www.} or {@code mobile.}), including
 * {@code /i/status/} and {@code /i/web/status/} forms. Query strings, fragments and trailing
 * path segments such as {@code /photo/1} are ignored.
 */
public final class TweetIdentifiers {
    private static final Pattern BARE_ID = Pattern.compile("\\d{1,20}");
    private static final Pattern STATUS_URL = Pattern.compile(
            "^(?:https?://)?(?:(?:www|mobile|m)\\.)?(?:twitter|x)\\.com/"
                    + "(?:i/web|i|@?([A-Za-z0-9_]{1,15}))/status(?:es)?/(\\d{1,20})(?:[/?#].*)?$",
            Pattern.CASE_INSENSITIVE);

    private TweetIdentifiers() {}

    public static Optional<TweetReference> parse(final String idOrUrl) {
        if (idOrUrl == null) return Optional.empty();
        final String input = idOrUrl.trim();
        if (BARE_ID.matcher(input).matches()) return Optional.of(new TweetReference(input, null));

        final Matcher m = STATUS_URL.matcher(input);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new TweetReference(m.group(2), m.group(1)));
    }

    public static TweetReference require(final String idOrUrl) {
        return parse(idOrUrl).orElseThrow(() -> new MalformedTweetIdentifierException(idOrUrl));
    }

    /** The canonical id, or empty for input that is neither an id nor a status URL. */
    public static Optional<String> canonicalId(final String idOrUrl) {
        return parse(idOrUrl).map(TweetReference::tweetId);
    }

    /** Strips a leading {@code @} and surrounding whitespace. */
    public static String cleanHandle(final String handle) {
        if (handle == null) return "";
        final String trimmed = handle.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }
}
