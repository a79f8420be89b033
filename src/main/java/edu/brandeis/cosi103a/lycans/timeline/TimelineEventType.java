package edu.brandeis.cosi103a.lycans.timeline;

public enum TimelineEventType {
    ACTION,
    VOTE,
    DEATH,
    ROLE_CHANGE,
    GAME_END
}
