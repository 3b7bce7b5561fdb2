package com.xpdustry.wordgrid.board;

import com.google.common.base.Preconditions;
import com.xpdustry.wordgrid.common.trie.Alphabet;
import com.xpdustry.wordgrid.common.trie.InvalidSymbolException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A rectangular grid of letters, each cell being adjacent to its eight surrounding cells.
 */
public final class LetterBoard {

    private final char[][] letters;
    private final int rows;
    private final int columns;

    private LetterBoard(final char[][] letters) {
        this.letters = letters;
        this.rows = letters.length;
        this.columns = letters[0].length;
    }

    /**
     * Creates a board from its rows, top to bottom. Rows are lowercased before validation.
     *
     * @throws InvalidSymbolException if a letter is outside the {@link Alphabet}
     */
    public static LetterBoard of(final String... rows) {
        Preconditions.checkNotNull(rows, "rows");
        Preconditions.checkArgument(rows.length > 0, "A board needs at least one row");
        final var width = rows[0].length();
        Preconditions.checkArgument(width > 0, "A board needs at least one column");

        final var letters = new char[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            final var row = rows[i].toLowerCase(Locale.ROOT);
            Preconditions.checkArgument(
                    row.length() == width, "Row %s has %s letters, expected %s", i, row.length(), width);
            for (int j = 0; j < width; j++) {
                if (!Alphabet.contains(row.charAt(j))) {
                    throw new InvalidSymbolException(row.charAt(j), j);
                }
            }
            letters[i] = row.toCharArray();
        }
        return new LetterBoard(letters);
    }

    public int rows() {
        return this.rows;
    }

    public int columns() {
        return this.columns;
    }

    public char letterAt(final Cell cell) {
        Preconditions.checkArgument(this.contains(cell), "%s is outside of the board", cell);
        return this.letters[cell.row()][cell.column()];
    }

    public boolean contains(final Cell cell) {
        return cell.row() >= 0 && cell.row() < this.rows && cell.column() >= 0 && cell.column() < this.columns;
    }

    public List<Cell> cells() {
        final List<Cell> cells = new ArrayList<>(this.rows * this.columns);
        for (int i = 0; i < this.rows; i++) {
            for (int j = 0; j < this.columns; j++) {
                cells.add(new Cell(i, j));
            }
        }
        return cells;
    }

    /**
     * Returns the cells adjacent to the given one, horizontally, vertically or diagonally, in row-major order.
     */
    public List<Cell> neighbours(final Cell cell) {
        Preconditions.checkArgument(this.contains(cell), "%s is outside of the board", cell);
        final List<Cell> neighbours = new ArrayList<>(8);
        for (int i = cell.row() - 1; i <= cell.row() + 1; i++) {
            for (int j = cell.column() - 1; j <= cell.column() + 1; j++) {
                final var neighbour = new Cell(i, j);
                if ((i != cell.row() || j != cell.column()) && this.contains(neighbour)) {
                    neighbours.add(neighbour);
                }
            }
        }
        return neighbours;
    }

    @Override
    public String toString() {
        final var builder = new StringBuilder("LetterBoard{");
        for (int i = 0; i < this.rows; i++) {
            if (i > 0) {
                builder.append('/');
            }
            builder.append(this.letters[i]);
        }
        return builder.append('}').toString();
    }
}
