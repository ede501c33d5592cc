package quest.gekko.kolmetrics.service.integration.provider;

public record ProfileMedia(String avatarUrl, String bannerUrl) {
    public static final ProfileMedia NONE = new ProfileMedia(null, null);

    public boolean isEmpty() {
        return avatarUrl == null && bannerUrl == null;
    }
}
