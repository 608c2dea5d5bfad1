package com.gdin.inspection.cognify.util;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.EdgeKey;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 确定性 id 生成。相同 (dataset, 类型, 规范化键) 永远得到相同 id，重跑不会产生重复节点。
 */
public final class DataPointIds {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DataPointIds() {
    }

    /**
     * 名称规范化：去首尾空白、转小写、空白折叠为下划线、去掉引号。
     */
    public static String normalizeName(String name) {
        if (StrUtil.isBlank(name)) return "";
        String s = name.trim().toLowerCase(Locale.ROOT);
        s = WHITESPACE.matcher(s).replaceAll("_");
        return s.replace("'", "").replace("\"", "");
    }

    public static String normalizeRelation(String label) {
        return normalizeName(label);
    }

    public static String of(String datasetId, DataPointType type, String key) {
        String raw = StrUtil.nullToEmpty(datasetId) + "|" + type.name() + "|" + key;
        return UUID.nameUUIDFromBytes(raw.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static String documentId(String datasetId, String contentHash) {
        return of(datasetId, DataPointType.DOCUMENT, contentHash);
    }

    public static String chunkId(String datasetId, String documentId, int chunkIndex) {
        return of(datasetId, DataPointType.DOCUMENT_CHUNK, documentId + "#" + chunkIndex);
    }

    public static String entityId(String datasetId, String entityName) {
        return of(datasetId, DataPointType.ENTITY, normalizeName(entityName));
    }

    public static String entityTypeId(String datasetId, String typeName) {
        return of(datasetId, DataPointType.ENTITY_TYPE, normalizeName(typeName));
    }

    /**
     * 摘要 id 只取决于来源分片，模型输出不同也不会产生新的摘要节点。
     */
    public static String summaryId(String datasetId, DataPointType summaryType, String chunkId) {
        return of(datasetId, summaryType, chunkId);
    }

    public static String edgeId(String datasetId, EdgeKey key) {
        String raw = StrUtil.nullToEmpty(datasetId) + "|EDGE|" + key;
        return UUID.nameUUIDFromBytes(raw.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
