package com.leakscope.core.scanner.dedupe;

import com.leakscope.core.model.Finding;

import java.util.List;

/** 스캔 단위 중복 제거 결과 (이번 호출 기준 수치). */
public record ScanDeduplicationResult(List<Finding> findings,
                                      int totalFindings,
                                      int uniqueFindings,
                                      int duplicatesRemoved,
                                      String deduplicationRate,
                                      long deduplicationTimeMs,
                                      boolean fallback,
                                      String fallbackReason) {
}
