package com.xpdustry.wordgrid.common.trie;

/**
 * The fixed symbol set of the trie, the lowercase ASCII letters {@code a} to {@code z}.
 */
public final class Alphabet {

    public static final int SIZE = 26;

    /**
     * Symbol carried by the root node.
     */
    public static final char NO_SYMBOL = '\0';

    private Alphabet() {}

    public static boolean contains(final char symbol) {
        return symbol >= 'a' && symbol <= 'z';
    }

    public static int indexOf(final char symbol) {
        if (!contains(symbol)) {
            throw new InvalidSymbolException(symbol);
        }
        return symbol - 'a';
    }

    public static char symbolOf(final int index) {
        if (index < 0 || index >= SIZE) {
            throw new IndexOutOfBoundsException("Symbol index out of range: " + index);
        }
        return (char) ('a' + index);
    }

    /**
     * Returns {@code true} if the text is non-empty and made of alphabet symbols only.
     */
    public static boolean isWord(final CharSequence text) {
        if (text.length() == 0) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!contains(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static void checkWord(final CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            final var c = text.charAt(i);
            if (!contains(c)) {
                throw new InvalidSymbolException(c, i);
            }
        }
    }
}
