package com.xpdustry.wordgrid.common.trie;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

final class WordTrieImpl implements WordTrie {

    private final NodeArena arena;
    private final int size;
    private final TrieNode root;

    WordTrieImpl(final NodeArena arena, final int size) {
        Preconditions.checkArgument(arena.isFrozen(), "The node arena must be frozen");
        this.arena = arena;
        this.size = size;
        this.root = new TrieNode(this, NodeArena.ROOT);
    }

    @Override
    public boolean containsPrefix(final CharSequence text) {
        return this.walk(text) != NodeArena.NO_NODE;
    }

    @Override
    public boolean containsWord(final CharSequence text) {
        final var node = this.walk(text);
        return node != NodeArena.NO_NODE && this.arena.completesWord(node);
    }

    @Override
    public Step step(final @Nullable TrieNode node, final char symbol) {
        var from = NodeArena.ROOT;
        if (node != null) {
            Preconditions.checkArgument(node.trie() == this, "The node does not belong to this trie");
            from = node.index();
        }
        final var next = this.arena.getChild(from, symbol);
        if (next == NodeArena.NO_NODE) {
            return Step.MISS;
        }
        return new Step(new TrieNode(this, next), true, this.arena.completesWord(next));
    }

    @Override
    public TrieNode root() {
        return this.root;
    }

    @Override
    public @Nullable TrieNode find(final CharSequence text) {
        final var node = this.walk(text);
        return node == NodeArena.NO_NODE ? null : new TrieNode(this, node);
    }

    @Override
    public int size() {
        return this.size;
    }

    @Override
    public int nodeCount() {
        return this.arena.size();
    }

    NodeArena arena() {
        return this.arena;
    }

    private int walk(final CharSequence text) {
        Preconditions.checkNotNull(text, "text");
        if (isBlank(text)) {
            return NodeArena.NO_NODE;
        }
        var node = NodeArena.ROOT;
        for (int i = 0; i < text.length(); i++) {
            final var c = text.charAt(i);
            if (!Alphabet.contains(c)) {
                throw new InvalidSymbolException(c, i);
            }
            node = this.arena.getChild(node, c);
            if (node == NodeArena.NO_NODE) {
                return NodeArena.NO_NODE;
            }
        }
        return node;
    }

    private static boolean isBlank(final CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
