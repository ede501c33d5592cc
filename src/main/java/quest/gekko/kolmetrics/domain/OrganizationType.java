package quest.gekko.kolmetrics.domain;

public enum OrganizationType { AGENCY, CLIENT }
