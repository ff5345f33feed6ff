package com.leakscope.core.scanner;

import java.util.Arrays;

/** 문자 오프셋 → 1-based (line, column) 변환. 줄 시작 오프셋을 한 번만 계산한다. */
final class LineIndex {
    private final int[] lineStarts;

    LineIndex(String content) {
        int[] starts = new int[16];
        int n = 0;
        starts[n++] = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                if (n == starts.length) starts = Arrays.copyOf(starts, n * 2);
                starts[n++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, n);
    }

    int line(int offset) {
        int pos = Arrays.binarySearch(lineStarts, offset);
        return (pos >= 0 ? pos : -pos - 2) + 1;
    }

    int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }
}
