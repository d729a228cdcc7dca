package com.aiprofessor.simulation.domain;

/** Per-session counters, each backed by one field of the session document. */
public enum ActivityCounter {
    MODULES_VIEWED("modules_viewed"),
    QUIZZES_VIEWED("quizzes_viewed"),
    AI_CHATS_OPENED("ai_chats_opened");

    private final String field;

    ActivityCounter(String field) {
        this.field = field;
    }

    /** Name of the document field holding the counter. */
    public String field() {
        return field;
    }
}
