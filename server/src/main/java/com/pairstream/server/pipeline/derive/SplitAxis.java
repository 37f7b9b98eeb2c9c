package com.pairstream.server.pipeline.derive;

public enum SplitAxis {
    /** Left and right halves. */
    WIDTH,
    /** Top and bottom halves. */
    HEIGHT
}
