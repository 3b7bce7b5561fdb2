package com.xpdustry.wordgrid.common.trie;

import com.google.common.base.Preconditions;
import gnu.trove.list.array.TCharArrayList;
import gnu.trove.list.array.TIntArrayList;
import java.util.ArrayList;
import java.util.BitSet;
import org.jspecify.annotations.Nullable;

/**
 * Owns every node of a trie. Nodes are addressed by their index in the arena, which never changes once assigned.
 *
 * <p>Children are kept in a dense table of {@link Alphabet#SIZE} slots per node, allocated on the first child. It
 * wastes slots on sparse nodes but resolves a child with a single array read. Only {@link #getChild(int, char)} and
 * {@link #setChild(int, char, int)} know the table layout.
 *
 * <p>The arena is written by a single thread until {@link #freeze()}, after which it is read-only.
 */
final class NodeArena {

    static final int ROOT = 0;
    static final int NO_NODE = -1;
    static final int NO_PARENT = -1;

    // The root is never a child, so its index doubles as the empty slot marker
    private static final int EMPTY_SLOT = ROOT;

    private final TCharArrayList symbols = new TCharArrayList();
    private final TIntArrayList parents = new TIntArrayList();
    private final ArrayList<int @Nullable []> children = new ArrayList<>();
    private final BitSet completes = new BitSet();
    private boolean frozen = false;

    NodeArena() {
        this.symbols.add(Alphabet.NO_SYMBOL);
        this.parents.add(NO_PARENT);
        this.children.add(null);
    }

    int size() {
        return this.symbols.size();
    }

    int create(final int parent, final char symbol) {
        this.checkMutable();
        Preconditions.checkState(
                this.getChild(parent, symbol) == NO_NODE, "Node %s already has a child for '%s'", parent, symbol);
        final var node = this.size();
        this.symbols.add(symbol);
        this.parents.add(parent);
        this.children.add(null);
        this.setChild(parent, symbol, node);
        return node;
    }

    int getChild(final int node, final char symbol) {
        final var slots = this.children.get(node);
        // Validated even on leaves so that bad input fails the same way on every node
        final var index = Alphabet.indexOf(symbol);
        if (slots == null) {
            return NO_NODE;
        }
        final var child = slots[index];
        return child == EMPTY_SLOT ? NO_NODE : child;
    }

    void setChild(final int node, final char symbol, final int child) {
        this.checkMutable();
        var slots = this.children.get(node);
        if (slots == null) {
            slots = new int[Alphabet.SIZE];
            this.children.set(node, slots);
        }
        slots[Alphabet.indexOf(symbol)] = child;
    }

    boolean hasChildren(final int node) {
        return this.children.get(node) != null;
    }

    char symbol(final int node) {
        return this.symbols.get(node);
    }

    int parent(final int node) {
        return this.parents.get(node);
    }

    boolean completesWord(final int node) {
        return this.completes.get(node);
    }

    /**
     * Flags the node as the end of a word, returns {@code true} if it was not flagged yet.
     */
    boolean markWord(final int node) {
        this.checkMutable();
        Preconditions.checkArgument(node != ROOT, "The root cannot complete a word");
        if (this.completes.get(node)) {
            return false;
        }
        this.completes.set(node);
        return true;
    }

    int depth(final int node) {
        var depth = 0;
        for (var current = node; current != ROOT; current = this.parents.get(current)) {
            depth++;
        }
        return depth;
    }

    String reconstructWord(final int node) {
        final var builder = new StringBuilder(this.depth(node));
        for (var current = node; current != ROOT; current = this.parents.get(current)) {
            builder.append(this.symbols.get(current));
        }
        return builder.reverse().toString();
    }

    void freeze() {
        this.checkMutable();
        this.frozen = true;
        this.symbols.trimToSize();
        this.parents.trimToSize();
        this.children.trimToSize();
    }

    boolean isFrozen() {
        return this.frozen;
    }

    private void checkMutable() {
        if (this.frozen) {
            throw new SealedTrieException("The node arena is frozen");
        }
    }
}
