package com.leakscope.core.model;

import java.util.Objects;

/** 발견 위치. line/column 은 1-based, 모르면 0. */
public record Location(String file, int line, int column, int index) {

    public Location {
        file = (file == null ? "" : file);
    }

    /** line/column 이 모두 채워진 위치만 재보고 판정 대상이 된다. */
    public boolean isKnown() { return line > 0 && column > 0; }

    /** 병합 시 동일 위치 판정 키: (file, line, column) */
    public boolean samePlace(Location o) {
        return o != null && line == o.line && column == o.column && Objects.equals(file, o.file);
    }
}
