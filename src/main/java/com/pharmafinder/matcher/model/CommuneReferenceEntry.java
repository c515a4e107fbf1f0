package com.pharmafinder.matcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * One row of the commune reference file.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommuneReferenceEntry {

    @JsonProperty("name")
    private String name;

    @JsonProperty("region")
    private String region;

    @JsonProperty("aliases")
    private List<String> aliases = new ArrayList<>();

    @JsonProperty("pharmacyCount")
    private int pharmacyCount;

    public CommuneRecord toRecord() {
        return new CommuneRecord(
                name == null ? null : name.trim(),
                region,
                aliases == null ? new LinkedHashSet<>() : new LinkedHashSet<>(aliases),
                pharmacyCount
        );
    }
}
