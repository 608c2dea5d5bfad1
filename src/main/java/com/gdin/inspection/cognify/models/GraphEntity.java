package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GraphEntity extends DataPoint {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type_id")
    private String typeId;

    @JsonProperty("type_name")
    private String typeName;

    /**
     * 多段描述用换行拼接，合并时按段去重。
     */
    @JsonProperty("description")
    private String description;

    @JsonProperty("ontology_valid")
    private boolean ontologyValid;

    @JsonProperty("relations")
    @Builder.Default
    private List<EntityRelation> relations = new ArrayList<>();

    @Override
    public DataPointType getType() {
        return DataPointType.ENTITY;
    }

    @Override
    public String embeddableText() {
        return name;
    }

    /**
     * 描述段与关系排序后再参与指纹，同一组事实无论以什么顺序合并进来指纹都相同。
     */
    @Override
    protected String fingerprintSource() {
        String rel = relations == null ? "" : relations.stream()
                .map(EntityRelation::asKey)
                .sorted()
                .collect(Collectors.joining(","));
        String desc = description == null ? "" : Arrays.stream(description.split("\n"))
                .map(String::trim)
                .filter(seg -> !seg.isEmpty())
                .distinct()
                .sorted()
                .collect(Collectors.joining("\n"));
        return name + "|" + typeId + "|" + desc + "|" + ontologyValid + "|" + rel;
    }
}
