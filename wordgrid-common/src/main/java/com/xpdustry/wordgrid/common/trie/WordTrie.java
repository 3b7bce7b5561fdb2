package com.xpdustry.wordgrid.common.trie;

import org.jspecify.annotations.Nullable;

/**
 * A sealed prefix trie over the {@link Alphabet}. Instances are immutable and can be shared between threads.
 *
 * <p>Words are inserted through a {@link Builder}, which stops accepting words once {@link Builder#seal()} returned
 * the trie. Queries are only available on the sealed trie, so nothing can be inserted once lookups started.
 */
public interface WordTrie {

    static Builder builder() {
        return new WordTrieBuilder();
    }

    static WordTrie create(final Iterable<? extends CharSequence> words) {
        return builder().insertAll(words).seal();
    }

    /**
     * Returns {@code true} if the text is a stored word or the start of one. Empty or blank text never matches.
     *
     * @throws InvalidSymbolException if the text contains a symbol outside the alphabet
     */
    boolean containsPrefix(final CharSequence text);

    /**
     * Returns {@code true} if the text is exactly a stored word. Empty or blank text never matches.
     *
     * @throws InvalidSymbolException if the text contains a symbol outside the alphabet
     */
    boolean containsWord(final CharSequence text);

    /**
     * Advances a traversal by one symbol. A {@code null} node starts from the root. A symbol with no matching child
     * returns {@link Step#MISS}.
     *
     * @throws InvalidSymbolException if the symbol is outside the alphabet
     * @throws IllegalArgumentException if the node belongs to another trie
     */
    Step step(final @Nullable TrieNode node, final char symbol);

    TrieNode root();

    /**
     * Returns the node spelled by the text, or {@code null} if the text is empty, blank or not a prefix.
     */
    @Nullable TrieNode find(final CharSequence text);

    /**
     * The number of distinct words.
     */
    int size();

    /**
     * The number of nodes, root included.
     */
    int nodeCount();

    record Step(@Nullable TrieNode node, boolean potentialPrefix, boolean completesWord) {

        public static final Step MISS = new Step(null, false, false);
    }

    interface Builder {

        /**
         * @throws SealedTrieException if the builder was already sealed
         * @throws InvalidSymbolException if the word contains a symbol outside the alphabet, nothing is inserted
         */
        Builder insert(final CharSequence word);

        default Builder insertAll(final Iterable<? extends CharSequence> words) {
            for (final var word : words) {
                this.insert(word);
            }
            return this;
        }

        /**
         * Ends the build phase. Can only be called once.
         *
         * @throws SealedTrieException if the builder was already sealed
         */
        WordTrie seal();
    }
}
