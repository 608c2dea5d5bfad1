package com.gdin.inspection.cognify.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GraphEntityType extends DataPoint {

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("ontology_valid")
    private boolean ontologyValid;

    @Override
    public DataPointType getType() {
        return DataPointType.ENTITY_TYPE;
    }

    @Override
    public String embeddableText() {
        return name;
    }

    @Override
    protected String fingerprintSource() {
        return name + "|" + description + "|" + ontologyValid;
    }
}
