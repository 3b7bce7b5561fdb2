package com.xpdustry.wordgrid.common.lexicon;

@SuppressWarnings("serial")
public final class LexiconLoadException extends RuntimeException {

    private final String source;

    public LexiconLoadException(final String source, final Exception cause) {
        super("Failed to load the lexicon from " + source, cause);
        this.source = source;
    }

    public String source() {
        return this.source;
    }
}
