package com.xpdustry.wordgrid.common.trie;

@SuppressWarnings("serial")
public final class SealedTrieException extends IllegalStateException {

    public SealedTrieException(final String message) {
        super(message);
    }
}
