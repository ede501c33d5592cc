package quest.gekko.kolmetrics.web.dto;

public record KolSummary(Long id, String name, String handle) {
}
