package quest.gekko.kolmetrics.web.dto;

public record KolScrapeResult(String kol, Long kolId, boolean success, int count, String error) {
}
