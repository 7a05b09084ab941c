package org.nullmask.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code nullmask.yaml}.
 */
@Data
public class NullMaskConfiguration {

    /**
     * Settings per profile name.
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("injection")
        private InjectionConfiguration injection;
    }

    /**
     * Injection defaults; every field is optional.
     */
    @Data
    public static class InjectionConfiguration {

        @JsonProperty("probability")
        private Double probability;

        @JsonProperty("pattern")
        private String pattern;

        @JsonProperty("columns")
        private List<String> columns;

        @JsonProperty("seed")
        private Long seed;

        @JsonProperty("parallelism")
        private Integer parallelism;
    }
}
