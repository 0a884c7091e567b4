package com.openforge.parley.nlu;

/** Purpose of an utterance. UNKNOWN is the guaranteed floor of classification. */
public enum IntentCategory {
    COMMAND,
    QUESTION,
    MATH,
    CODE,
    FETCH,
    CONVERSATIONAL,
    UNKNOWN
}
