package com.xpdustry.wordgrid.board;

import java.util.List;

public record FoundWord(String word, List<Cell> path) {

    public FoundWord(final String word, final List<Cell> path) {
        this.word = word;
        this.path = List.copyOf(path);
    }
}
