package com.gdin.inspection.cognify.index.update;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.cognify.models.EntityRelation;
import com.gdin.inspection.cognify.models.GraphEntity;
import com.gdin.inspection.cognify.util.DataPointIds;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 同 id 实体的合并规则：
 * <ul>
 *     <li>与已提交实体合并时，名称与类型取已提交的一方；</li>
 *     <li>批内尚未提交的候选之间，类型按固定顺序挑选：本体内类型优先，其次规范化类型名升序；名称取字典序较小者；</li>
 *     <li>描述按段取并集并排序，关系按 (label, target) 去重并排序。</li>
 * </ul>
 * 合并是幂等的，且批内合并结果与候选出现顺序无关。
 */
@Slf4j
@Service
public class EntityMergeService {

    @Value
    public static class MergeOutcome {
        GraphEntity entity;
        boolean typeConflict;
    }

    /**
     * existing 为已提交的实体，类型冲突时保留 existing 的类型。
     */
    public MergeOutcome merge(GraphEntity existing, GraphEntity incoming) {
        if (existing == null) return new MergeOutcome(incoming, false);
        if (incoming == null) return new MergeOutcome(existing, false);

        boolean conflict = isTypeConflict(existing, incoming);
        if (conflict) {
            log.warn("实体类型冲突，保留已提交类型: entity={}, kept={}, dropped={}",
                    existing.getName(), existing.getTypeName(), incoming.getTypeName());
        }
        GraphEntity typeSource = existing.getTypeId() != null ? existing : incoming;
        String name = StrUtil.blankToDefault(existing.getName(), incoming.getName());
        return new MergeOutcome(combine(existing, incoming, name, typeSource), conflict);
    }

    /**
     * 批内按 id 聚合。两个候选都未提交，类型与名称按 {@link #preferredType} 和字典序确定。
     */
    public List<GraphEntity> collapse(List<GraphEntity> entities) {
        if (CollectionUtil.isEmpty(entities)) return new ArrayList<>();
        Map<String, GraphEntity> grouped = new LinkedHashMap<>();
        for (GraphEntity e : entities) {
            if (e == null || e.getId() == null) continue;
            grouped.merge(e.getId(), e, EntityMergeService::mergeCandidates);
        }
        return new ArrayList<>(grouped.values());
    }

    static GraphEntity mergeCandidates(GraphEntity a, GraphEntity b) {
        if (isTypeConflict(a, b)) {
            log.debug("批内实体类型不一致: entity={}, types=[{}, {}]", a.getName(), a.getTypeName(), b.getTypeName());
        }
        String name = smaller(a.getName(), b.getName());
        return combine(a, b, name, preferredType(a, b));
    }

    /**
     * 有类型的优先，其次本体内类型优先，再按规范化类型名、类型 id 升序。
     */
    static GraphEntity preferredType(GraphEntity a, GraphEntity b) {
        if (a.getTypeId() == null) return b;
        if (b.getTypeId() == null) return a;
        if (a.isOntologyValid() != b.isOntologyValid()) return a.isOntologyValid() ? a : b;
        int cmp = StrUtil.compare(DataPointIds.normalizeName(a.getTypeName()), DataPointIds.normalizeName(b.getTypeName()), true);
        if (cmp == 0) cmp = a.getTypeId().compareTo(b.getTypeId());
        return cmp <= 0 ? a : b;
    }

    private static GraphEntity combine(GraphEntity a, GraphEntity b, String name, GraphEntity typeSource) {
        return GraphEntity.builder()
                .id(a.getId())
                .datasetId(a.getDatasetId())
                .name(name)
                .typeId(typeSource.getTypeId())
                .typeName(typeSource.getTypeName())
                .ontologyValid(typeSource.isOntologyValid())
                .description(mergeDescriptions(a.getDescription(), b.getDescription()))
                .relations(mergeRelations(a.getRelations(), b.getRelations()))
                .metadata(mergeMetadata(a.getMetadata(), b.getMetadata()))
                .embedding(b.getEmbedding() != null ? b.getEmbedding() : a.getEmbedding())
                .build();
    }

    private static boolean isTypeConflict(GraphEntity a, GraphEntity b) {
        return a.getTypeId() != null && b.getTypeId() != null && !a.getTypeId().equals(b.getTypeId());
    }

    private static String smaller(String a, String b) {
        if (StrUtil.isBlank(a)) return b;
        if (StrUtil.isBlank(b)) return a;
        return a.compareTo(b) <= 0 ? a : b;
    }

    static String mergeDescriptions(String a, String b) {
        Set<String> segments = new TreeSet<>();
        for (String s : List.of(StrUtil.nullToEmpty(a), StrUtil.nullToEmpty(b))) {
            for (String seg : s.split("\n")) {
                if (StrUtil.isNotBlank(seg)) segments.add(seg.trim());
            }
        }
        return String.join("\n", segments);
    }

    static List<EntityRelation> mergeRelations(List<EntityRelation> a, List<EntityRelation> b) {
        Map<String, EntityRelation> byKey = new TreeMap<>();
        for (List<EntityRelation> list : List.of(
                a == null ? List.<EntityRelation>of() : a,
                b == null ? List.<EntityRelation>of() : b)) {
            for (EntityRelation r : list) {
                if (r != null) byKey.putIfAbsent(r.asKey(), r);
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private static Map<String, Object> mergeMetadata(Map<String, Object> a, Map<String, Object> b) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (a != null) out.putAll(a);
        if (b != null) out.putAll(b);
        return out;
    }
}
