package com.gdin.inspection.cognify.models;

/**
 * 边的逻辑主键，关系标签已规范化。
 */
public record EdgeKey(String sourceId, String relation, String targetId) {

    @Override
    public String toString() {
        return sourceId + "_" + targetId + "_" + relation;
    }
}
