package com.leakscope.core.scanner;

import java.util.ArrayList;
import java.util.List;

/** 이미 점유된 [start,end) 구간 목록. scanContent 1회 동안만 산다. */
public final class PositionLedger {
    private final List<int[]> ranges = new ArrayList<>();

    /**
     * 후보 [s,e) 가 기존 구간 [ps,pe) 와 겹치는지.
     * 시작점 포함/끝점 포함/완전 포함 중 하나라도 성립하면 겹침 (길이 0 후보도 판정됨).
     */
    public boolean overlaps(int s, int e) {
        for (int[] r : ranges) {
            int ps = r[0], pe = r[1];
            if ((s >= ps && s < pe) || (e > ps && e <= pe) || (s <= ps && e >= pe)) return true;
        }
        return false;
    }

    public void claim(int s, int e) {
        ranges.add(new int[]{s, e});
    }

    public int size() { return ranges.size(); }
}
