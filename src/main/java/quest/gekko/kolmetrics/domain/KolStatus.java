package quest.gekko.kolmetrics.domain;

public enum KolStatus { PENDING, ACTIVE, INACTIVE, BLACKLISTED }
