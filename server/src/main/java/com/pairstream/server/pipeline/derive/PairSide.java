package com.pairstream.server.pipeline.derive;

public enum PairSide {
    INPUT,
    TARGET;

    public PairSide other() {
        return this == INPUT ? TARGET : INPUT;
    }
}
