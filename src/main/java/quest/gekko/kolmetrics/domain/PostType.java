package quest.gekko.kolmetrics.domain;

public enum PostType { POST, RETWEET, QUOTE, THREAD, SPACE }
