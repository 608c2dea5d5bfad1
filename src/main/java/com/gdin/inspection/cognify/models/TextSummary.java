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
public class TextSummary extends DataPoint {

    @JsonProperty("text")
    private String text;

    /**
     * 来源分片 id。
     */
    @JsonProperty("made_from")
    private String madeFrom;

    @Override
    public DataPointType getType() {
        return DataPointType.TEXT_SUMMARY;
    }

    @Override
    public String embeddableText() {
        return text;
    }

    @Override
    protected String fingerprintSource() {
        return madeFrom + "|" + text;
    }
}
