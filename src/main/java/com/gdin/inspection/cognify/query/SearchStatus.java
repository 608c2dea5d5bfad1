package com.gdin.inspection.cognify.query;

public enum SearchStatus {
    OK,
    /** 检索成功但没有结果 */
    EMPTY,
    /** 混合检索中一路不可用，结果只来自另一路 */
    DEGRADED,
    /** 所需的后端全部不可用 */
    UNAVAILABLE
}
