package com.swearguard.bot.service;

/**
 * Outcome of one filter evaluation.
 *
 * @param term the banned term or short form that matched, or null
 */
public record Verdict(boolean blocked, Stage stage, String term) {
    public enum Stage {
        CACHE,
        EMPTY,
        RAW_VARIANT,
        SAFE_WORD,
        DIRECT,
        ROOT_SUFFIX,
        SUFFIX_RULE,
        SHORT_FORM,
        PHONETIC,
        NONE
    }

    static Verdict blocked(Stage stage, String term) {
        return new Verdict(true, stage, term);
    }

    static Verdict allowed(Stage stage) {
        return new Verdict(false, stage, null);
    }
}
