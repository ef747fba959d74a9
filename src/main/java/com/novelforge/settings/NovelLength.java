package com.novelforge.settings;

/**
 * Target length buckets used to shape planning guidance.
 */
public enum NovelLength {
    SHORT_STORY("Short Story", "3,000-10,000 words", "Focused, single plot thread with clear beginning, middle, end",
        "1-3 main characters, minimal supporting cast"),
    NOVELLA("Novella", "20,000-50,000 words", "Single main plot with 1-2 subplots",
        "2-4 main characters, modest supporting cast"),
    NOVEL("Novel", "50,000-110,000 words", "Main plot with 2-3 substantial subplots",
        "3-6 main characters, full supporting cast"),
    VERY_LONG_NOVEL("Very Long Novel", "110,000-200,000 words", "Epic scope with multiple plot threads and subplots",
        "4-8+ main characters, extensive cast"),
    CUSTOM("Custom", "As specified by the user", "Appropriate for the specified length",
        "Match the narrative complexity to the word count");

    private final String label;
    private final String wordRange;
    private final String structure;
    private final String cast;

    NovelLength(String label, String wordRange, String structure, String cast) {
        this.label = label;
        this.wordRange = wordRange;
        this.structure = structure;
        this.cast = cast;
    }

    public String getLabel() {
        return label;
    }

    public String getWordRange() {
        return wordRange;
    }

    public String getStructure() {
        return structure;
    }

    public String getCast() {
        return cast;
    }
}
