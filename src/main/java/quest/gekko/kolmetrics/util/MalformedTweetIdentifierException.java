package quest.gekko.kolmetrics.util;

public class MalformedTweetIdentifierException extends IllegalArgumentException {
    public MalformedTweetIdentifierException(final String input) {
        super("Not a tweet id or status URL: " + input);
    }
}
