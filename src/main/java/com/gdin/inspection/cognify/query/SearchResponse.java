package com.gdin.inspection.cognify.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {

    @JsonProperty("status")
    SearchStatus status;

    @JsonProperty("mode")
    SearchMode mode;

    @JsonProperty("hits")
    @Singular
    List<SearchHit> hits;

    @JsonProperty("unavailable_modes")
    @Singular
    List<SearchMode> unavailableModes;

    @JsonProperty("message")
    String message;
}
