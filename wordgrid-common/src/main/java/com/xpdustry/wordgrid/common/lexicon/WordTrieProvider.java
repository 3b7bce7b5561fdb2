package com.xpdustry.wordgrid.common.lexicon;

import com.xpdustry.wordgrid.common.trie.WordTrie;
import com.xpdustry.wordgrid.common.word.WordSource;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class WordTrieProvider implements Provider<WordTrie> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WordTrieProvider.class);

    private final WordSource source;

    @Inject
    WordTrieProvider(final WordSource source) {
        this.source = source;
    }

    @Override
    public WordTrie get() {
        final var start = System.nanoTime();
        final WordTrie trie;
        try {
            trie = WordTrie.create(this.source.load());
        } catch (final IOException e) {
            throw new LexiconLoadException(this.source.describe(), e);
        }
        LOGGER.info(
                "Loaded {} words ({} nodes) from {} in {}ms",
                trie.size(),
                trie.nodeCount(),
                this.source.describe(),
                Duration.ofNanos(System.nanoTime() - start).toMillis());
        return trie;
    }
}
