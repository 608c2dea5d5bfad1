package com.gdin.inspection.cognify.query;

public enum SearchMode {
    /** 向量相似度 */
    SEMANTIC,
    /** 以实体为锚点的图遍历 */
    STRUCTURAL,
    /** 两路结果融合 */
    HYBRID
}
