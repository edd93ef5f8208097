package com.scorestats.platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A gameplay modifier as submitted with a score.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Mod {
    private String acronym;
    private Map<String, Object> settings;
    
    public Mod(String acronym) {
        this.acronym = acronym;
    }
    
    @JsonIgnore
    public boolean usesDefaultConfiguration() {
        return settings == null || settings.isEmpty();
    }
}
