package com.xpdustry.wordgrid.common.trie;

import org.jspecify.annotations.Nullable;

/**
 * Handle on a node of a sealed {@link WordTrie}, meant to be carried around by searches driving
 * {@link WordTrie#step(TrieNode, char)}.
 */
public final class TrieNode {

    private final WordTrieImpl trie;
    private final int index;

    TrieNode(final WordTrieImpl trie, final int index) {
        this.trie = trie;
        this.index = index;
    }

    public char symbol() {
        return this.trie.arena().symbol(this.index);
    }

    public boolean completesWord() {
        return this.trie.arena().completesWord(this.index);
    }

    public boolean isRoot() {
        return this.index == NodeArena.ROOT;
    }

    public boolean hasChildren() {
        return this.trie.arena().hasChildren(this.index);
    }

    public int depth() {
        return this.trie.arena().depth(this.index);
    }

    public @Nullable TrieNode parent() {
        final var parent = this.trie.arena().parent(this.index);
        return parent == NodeArena.NO_PARENT ? null : new TrieNode(this.trie, parent);
    }

    public @Nullable TrieNode child(final char symbol) {
        final var child = this.trie.arena().getChild(this.index, symbol);
        return child == NodeArena.NO_NODE ? null : new TrieNode(this.trie, child);
    }

    /**
     * Rebuilds the word spelled by the path from the root to this node, empty for the root.
     */
    public String word() {
        return this.trie.arena().reconstructWord(this.index);
    }

    WordTrieImpl trie() {
        return this.trie;
    }

    int index() {
        return this.index;
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof TrieNode that && this.trie == that.trie && this.index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(this.trie) + this.index;
    }

    @Override
    public String toString() {
        return "TrieNode{word=" + this.word() + ", completesWord=" + this.completesWord() + "}";
    }
}
