package quest.gekko.kolmetrics.domain;

public enum PostStatus { DRAFT, PENDING_APPROVAL, APPROVED, REJECTED, SCHEDULED, POSTED, VERIFIED }
