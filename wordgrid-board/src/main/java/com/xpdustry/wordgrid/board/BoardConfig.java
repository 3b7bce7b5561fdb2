package com.xpdustry.wordgrid.board;

import com.google.common.base.Preconditions;

public record BoardConfig(int minimumLength) {

    public static final BoardConfig DEFAULT = new BoardConfig(3);

    public BoardConfig {
        Preconditions.checkArgument(minimumLength >= 1, "The minimum length must be positive, got %s", minimumLength);
    }
}
