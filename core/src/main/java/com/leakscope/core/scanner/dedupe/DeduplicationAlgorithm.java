package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.model.Finding;

import java.util.List;

/** 병합 루틴. ResilientDeduplicator 가 감싸서 타임아웃/실패 시 fallback 한다. */
@FunctionalInterface
public interface DeduplicationAlgorithm {

    /**
     * @param findings    null 항목이 섞여 있을 수 있음 (건너뜀)
     * @param defaultFile 항목에 file 이 없을 때 쓸 경로 (null 허용)
     * @param deadline    항목 사이에서 check() 호출
     */
    List<Finding> deduplicate(List<Finding> findings, String defaultFile, Deadline deadline);
}
