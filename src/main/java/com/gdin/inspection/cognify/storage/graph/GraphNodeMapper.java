package com.gdin.inspection.cognify.storage.graph;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.models.CodeSummary;
import com.gdin.inspection.cognify.models.DataPoint;
import com.gdin.inspection.cognify.models.DataPointType;
import com.gdin.inspection.cognify.models.Document;
import com.gdin.inspection.cognify.models.DocumentChunk;
import com.gdin.inspection.cognify.models.Edge;
import com.gdin.inspection.cognify.models.EntityRelation;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.models.GraphEntityType;
import com.gdin.inspection.cognify.models.TextSummary;
import com.gdin.inspection.cognify.util.DataPointIds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 数据点与图库节点/边属性之间的转换。图库属性只用基本类型与字符串列表。
 */
public final class GraphNodeMapper {

    public static final String NAME = "name";
    public static final String NORMALIZED_NAME = "normalized_name";
    public static final String DESCRIPTION = "description";
    public static final String TYPE_ID = "type_id";
    public static final String TYPE_NAME = "type_name";
    public static final String ONTOLOGY_VALID = "ontology_valid";
    public static final String RELATIONS = "relations";
    public static final String TEXT = "text";
    public static final String PROVENANCE = "provenance";
    public static final String EDGE_ID = "edge_id";

    private static final int MAX_TEXT_CHARS = 4000;

    private GraphNodeMapper() {
    }

    public static GraphNode toNode(DataPoint dp) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("data_point_type", dp.getType().name());
        if (dp instanceof GraphEntity e) {
            props.put(NAME, e.getName());
            props.put(NORMALIZED_NAME, DataPointIds.normalizeName(e.getName()));
            props.put(DESCRIPTION, StrUtil.nullToEmpty(e.getDescription()));
            props.put(TYPE_ID, StrUtil.nullToEmpty(e.getTypeId()));
            props.put(TYPE_NAME, StrUtil.nullToEmpty(e.getTypeName()));
            props.put(ONTOLOGY_VALID, e.isOntologyValid());
            props.put(RELATIONS, e.getRelations().stream().map(EntityRelation::asKey).toList());
        } else if (dp instanceof GraphEntityType t) {
            props.put(NAME, t.getName());
            props.put(NORMALIZED_NAME, DataPointIds.normalizeName(t.getName()));
            props.put(DESCRIPTION, StrUtil.nullToEmpty(t.getDescription()));
            props.put(ONTOLOGY_VALID, t.isOntologyValid());
        } else if (dp instanceof DocumentChunk c) {
            props.put(TEXT, StrUtil.sub(c.getText(), 0, MAX_TEXT_CHARS));
            props.put("document_id", c.getDocumentId());
            props.put("chunk_index", c.getChunkIndex());
            props.put("contains", new ArrayList<>(c.getContains()));
        } else if (dp instanceof Document d) {
            props.put(NAME, d.getName());
            props.put("mime_type", StrUtil.nullToEmpty(d.getMimeType()));
            props.put("category", String.valueOf(d.getCategory()));
            props.put("content_hash", d.getContentHash());
        } else if (dp instanceof TextSummary s) {
            props.put(TEXT, StrUtil.sub(s.getText(), 0, MAX_TEXT_CHARS));
            props.put("made_from", s.getMadeFrom());
        } else if (dp instanceof CodeSummary s) {
            props.put(TEXT, StrUtil.sub(s.getText(), 0, MAX_TEXT_CHARS));
            props.put("summarizes", s.getSummarizes());
        }
        return GraphNode.builder()
                .id(dp.getId())
                .datasetId(dp.getDatasetId())
                .label(dp.getType().name())
                .properties(props)
                .build();
    }

    public static GraphEdge toEdge(Edge edge, Collection<String> provenance) {
        Map<String, Object> props = new LinkedHashMap<>(edge.getProperties());
        props.put(EDGE_ID, edge.getId());
        props.put(PROVENANCE, new ArrayList<>(provenance));
        return GraphEdge.builder()
                .sourceId(edge.getSourceId())
                .relation(edge.getRelation())
                .targetId(edge.getTargetId())
                .datasetId(edge.getDatasetId())
                .properties(props)
                .build();
    }

    public static boolean isEntity(GraphNode node) {
        return DataPointType.ENTITY.name().equals(node.getLabel());
    }

    /**
     * 图库中的实体节点还原为 {@link GraphEntity}，供去重合并使用。
     */
    public static GraphEntity toEntity(GraphNode node) {
        List<EntityRelation> relations = new ArrayList<>();
        for (String key : stringList(node.getProperties().get(RELATIONS))) {
            int idx = key.lastIndexOf("->");
            if (idx <= 0) continue;
            relations.add(EntityRelation.builder()
                    .label(key.substring(0, idx))
                    .targetId(key.substring(idx + 2))
                    .build());
        }
        return GraphEntity.builder()
                .id(node.getId())
                .datasetId(node.getDatasetId())
                .name(node.stringProperty(NAME))
                .description(node.stringProperty(DESCRIPTION))
                .typeId(StrUtil.emptyToNull(node.stringProperty(TYPE_ID)))
                .typeName(StrUtil.emptyToNull(node.stringProperty(TYPE_NAME)))
                .ontologyValid(Boolean.TRUE.equals(node.getProperties().get(ONTOLOGY_VALID)))
                .relations(relations)
                .build();
    }

    public static Set<String> provenance(GraphEdge edge) {
        return new LinkedHashSet<>(stringList(edge.getProperties().get(PROVENANCE)));
    }

    private static List<String> stringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> c) {
            for (Object o : c) {
                if (o != null) out.add(String.valueOf(o));
            }
        }
        return out;
    }
}
