package com.xpdustry.wordgrid.board;

import com.google.common.base.Preconditions;
import com.xpdustry.wordgrid.common.trie.TrieNode;
import com.xpdustry.wordgrid.common.trie.WordTrie;
import jakarta.inject.Inject;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class BoardSearchImpl implements BoardSearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoardSearchImpl.class);

    private final WordTrie trie;
    private final BoardConfig config;

    @Inject
    public BoardSearchImpl(final WordTrie trie, final BoardConfig config) {
        this.trie = trie;
        this.config = config;
    }

    @Override
    public List<FoundWord> search(final LetterBoard board) {
        Preconditions.checkNotNull(board, "board");
        final var state = new SearchState(board);
        for (final var cell : board.cells()) {
            this.visit(state, null, cell);
        }
        final List<FoundWord> result = new ArrayList<>(state.found.values());
        result.sort(Comparator.comparing(FoundWord::word));
        LOGGER.debug("Found {} words on {} after {} steps", result.size(), board, state.steps);
        return result;
    }

    private void visit(final SearchState state, final @Nullable TrieNode node, final Cell cell) {
        state.steps++;
        final var step = this.trie.step(node, state.board.letterAt(cell));
        final var next = step.node();
        if (!step.potentialPrefix() || next == null) {
            return;
        }

        state.visited[cell.row()][cell.column()] = true;
        state.path.addLast(cell);

        if (step.completesWord() && state.path.size() >= this.config.minimumLength()) {
            final var word = next.word();
            if (!state.found.containsKey(word)) {
                state.found.put(word, new FoundWord(word, List.copyOf(state.path)));
            }
        }

        if (next.hasChildren()) {
            for (final var neighbour : state.board.neighbours(cell)) {
                if (!state.visited[neighbour.row()][neighbour.column()]) {
                    this.visit(state, next, neighbour);
                }
            }
        }

        state.path.removeLast();
        state.visited[cell.row()][cell.column()] = false;
    }

    private static final class SearchState {
        private final LetterBoard board;
        private final boolean[][] visited;
        private final Deque<Cell> path = new ArrayDeque<>();
        private final Map<String, FoundWord> found = new LinkedHashMap<>();
        private long steps = 0;

        private SearchState(final LetterBoard board) {
            this.board = board;
            this.visited = new boolean[board.rows()][board.columns()];
        }
    }
}
