package com.example.xlsxtpl.core;

import lombok.Value;

/**
 * Per-iteration metadata published to expressions inside a for body.
 */
@Value
public class LoopRecord {
    int index;
    int index0;
    boolean first;
    boolean last;
    int length;
    int revindex;
    int revindex0;

    public static LoopRecord of(int index0, int length) {
        return new LoopRecord(
                index0 + 1,
                index0,
                index0 == 0,
                index0 == length - 1,
                length,
                length - index0,
                length - index0 - 1);
    }
}
