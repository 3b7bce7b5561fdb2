package com.xpdustry.wordgrid.common.trie;

@SuppressWarnings("serial")
public final class InvalidSymbolException extends IllegalArgumentException {

    private final char symbol;
    private final int index;

    public InvalidSymbolException(final char symbol) {
        this(symbol, -1);
    }

    public InvalidSymbolException(final char symbol, final int index) {
        super(index < 0
                ? "Symbol %s is outside of the alphabet".formatted(describe(symbol))
                : "Symbol %s at index %d is outside of the alphabet".formatted(describe(symbol), index));
        this.symbol = symbol;
        this.index = index;
    }

    public char symbol() {
        return this.symbol;
    }

    /**
     * Position of the symbol in the rejected text, or {@code -1} when the symbol was given alone.
     */
    public int index() {
        return this.index;
    }

    private static String describe(final char symbol) {
        return Character.isISOControl(symbol) || Character.isWhitespace(symbol)
                ? "U+%04X".formatted((int) symbol)
                : "'" + symbol + "'";
    }
}
