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
public class CodeSummary extends DataPoint {

    @JsonProperty("text")
    private String text;

    @JsonProperty("summarizes")
    private String summarizes;

    @Override
    public DataPointType getType() {
        return DataPointType.CODE_SUMMARY;
    }

    @Override
    public String embeddableText() {
        return text;
    }

    @Override
    protected String fingerprintSource() {
        return summarizes + "|" + text;
    }
}
