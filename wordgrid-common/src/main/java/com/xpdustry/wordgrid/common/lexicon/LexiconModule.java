package com.xpdustry.wordgrid.common.lexicon;

import com.google.common.base.Preconditions;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.xpdustry.wordgrid.common.trie.WordTrie;
import com.xpdustry.wordgrid.common.word.PathWordSource;
import com.xpdustry.wordgrid.common.word.ResourceWordSource;
import com.xpdustry.wordgrid.common.word.WordListReader;
import com.xpdustry.wordgrid.common.word.WordSource;
import jakarta.inject.Inject;
import jakarta.inject.Provider;

public final class LexiconModule implements Module {

    private final LexiconConfig config;

    public LexiconModule(final LexiconConfig config) {
        this.config = Preconditions.checkNotNull(config, "config");
    }

    @Override
    public void configure(final Binder binder) {
        binder.bind(LexiconConfig.class).toInstance(this.config);
        binder.bind(WordSource.class).toProvider(WordSourceProvider.class).asEagerSingleton();
        binder.bind(WordTrie.class).toProvider(WordTrieProvider.class).asEagerSingleton();
    }

    private static final class WordSourceProvider implements Provider<WordSource> {

        private final LexiconConfig config;

        @Inject
        public WordSourceProvider(final LexiconConfig config) {
            this.config = config;
        }

        @Override
        public WordSource get() {
            final var reader = new WordListReader(this.config.minimumLength());
            final var source = this.config.source();
            if (source instanceof WordSourceConfig.File file) {
                return new PathWordSource(file.path(), reader);
            } else if (source instanceof WordSourceConfig.Resource resource) {
                return new ResourceWordSource(resource.path(), LexiconModule.class.getClassLoader(), reader);
            } else {
                throw new IllegalStateException("Unexpected value: " + source);
            }
        }
    }
}
