package net.homeroute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvironmentDraft(
    String name,
    String prefix,
    String apiPrefix,
    @JsonProperty("isDefault") Boolean isDefault
) {
}
