package com.phillippitts.speakagent.domain;

/**
 * Coarse language tag of the latest input. Only affects phrasing of replies.
 */
public enum Language {
    EN,
    ES
}
