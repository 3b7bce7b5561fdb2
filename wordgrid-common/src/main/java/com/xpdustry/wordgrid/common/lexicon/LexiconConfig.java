package com.xpdustry.wordgrid.common.lexicon;

import com.google.common.base.Preconditions;

public record LexiconConfig(WordSourceConfig source, int minimumLength) {

    public LexiconConfig {
        Preconditions.checkNotNull(source, "source");
        Preconditions.checkArgument(minimumLength >= 1, "The minimum length must be positive, got %s", minimumLength);
    }

    public LexiconConfig(final WordSourceConfig source) {
        this(source, 1);
    }
}
