package com.phillippitts.speakagent.domain;

import java.util.Set;

/**
 * Intent names understood by the assistant.
 */
public final class Intents {

    public static final String SEND_MESSAGE = "send_message";
    public static final String SET_REMINDER = "set_reminder";
    public static final String CREATE_NOTE = "create_note";
    public static final String OPEN_APP = "open_app";
    public static final String OPEN_URL = "open_url";
    public static final String SEARCH_WEB = "search_web";
    public static final String SET_TIMER = "set_timer";
    public static final String CANCEL = "cancel";
    public static final String CONFIRM = "confirm";
    public static final String GREETING = "greeting";
    public static final String GENERAL_QUERY = "general_query";
    public static final String UNKNOWN = "unknown";

    /** Every intent name a classifier may return; anything else is mapped to {@link #UNKNOWN}. */
    public static final Set<String> ALL = Set.of(
            SEND_MESSAGE, SET_REMINDER, CREATE_NOTE, OPEN_APP, OPEN_URL, SEARCH_WEB, SET_TIMER,
            CANCEL, CONFIRM, GREETING, GENERAL_QUERY, UNKNOWN);

    /** Intents answered by conversation alone; they never require slots. */
    public static final Set<String> CONVERSATIONAL = Set.of(GENERAL_QUERY, UNKNOWN, GREETING);

    private Intents() {
    }

    public static boolean isKnown(String intent) {
        return intent != null && ALL.contains(intent);
    }
}
