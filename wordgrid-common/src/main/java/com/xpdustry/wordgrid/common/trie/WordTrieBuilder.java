package com.xpdustry.wordgrid.common.trie;

import com.google.common.base.Preconditions;
import java.util.concurrent.atomic.AtomicBoolean;

// Single writer, the builder is not meant to be shared while words are inserted
final class WordTrieBuilder implements WordTrie.Builder {

    private final NodeArena arena = new NodeArena();
    private final AtomicBoolean sealed = new AtomicBoolean(false);
    private int size = 0;

    @Override
    public WordTrie.Builder insert(final CharSequence word) {
        Preconditions.checkNotNull(word, "word");
        if (this.sealed.get()) {
            throw new SealedTrieException("The trie has been sealed, no more words can be inserted");
        }
        Preconditions.checkArgument(word.length() > 0, "Cannot insert an empty word");
        Alphabet.checkWord(word);

        var node = NodeArena.ROOT;
        for (int i = 0; i < word.length(); i++) {
            final var c = word.charAt(i);
            var next = this.arena.getChild(node, c);
            if (next == NodeArena.NO_NODE) {
                next = this.arena.create(node, c);
            }
            node = next;
        }

        if (this.arena.markWord(node)) {
            this.size++;
        }
        return this;
    }

    @Override
    public WordTrie seal() {
        if (this.sealed.getAndSet(true)) {
            throw new SealedTrieException("The trie has already been sealed");
        }
        this.arena.freeze();
        return new WordTrieImpl(this.arena, this.size);
    }
}
