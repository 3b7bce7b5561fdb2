package com.xpdustry.wordgrid.board;

public record Cell(int row, int column) {

    @Override
    public String toString() {
        return "(" + this.row + ", " + this.column + ")";
    }
}
