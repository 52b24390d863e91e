package io.github.monossa.ast;

public enum UnaryOp {
    NOT("!"),
    MINUS("-"),
    ;

    public final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }
}
