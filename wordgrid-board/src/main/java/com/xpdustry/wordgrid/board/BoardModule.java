package com.xpdustry.wordgrid.board;

import com.google.common.base.Preconditions;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Singleton;

/**
 * Binds {@link BoardSearch}. Expects a {@link com.xpdustry.wordgrid.common.trie.WordTrie} binding, usually from
 * {@link com.xpdustry.wordgrid.common.lexicon.LexiconModule}.
 */
public final class BoardModule implements Module {

    private final BoardConfig config;

    public BoardModule(final BoardConfig config) {
        this.config = Preconditions.checkNotNull(config, "config");
    }

    public BoardModule() {
        this(BoardConfig.DEFAULT);
    }

    @Override
    public void configure(final Binder binder) {
        binder.bind(BoardConfig.class).toInstance(this.config);
        binder.bind(BoardSearch.class).to(BoardSearchImpl.class).in(Singleton.class);
    }
}
