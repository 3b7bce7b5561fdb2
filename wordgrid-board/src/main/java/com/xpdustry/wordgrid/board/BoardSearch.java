package com.xpdustry.wordgrid.board;

import com.xpdustry.wordgrid.common.trie.WordTrie;
import java.util.List;

public interface BoardSearch {

    static BoardSearch create(final WordTrie trie, final BoardConfig config) {
        return new BoardSearchImpl(trie, config);
    }

    /**
     * Finds the words that can be spelled by a path of adjacent cells, each cell used at most once per path.
     * Every word is reported once, with the first path found, and the result is sorted by word.
     */
    List<FoundWord> search(final LetterBoard board);
}
