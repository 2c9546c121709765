package com.example.notebookengine.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML notebook template: a titled list of cells plus the variables a caller
 * is expected to seed when running the resulting notebook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotebookTemplate {

    private String id;
    private String name;
    private String description;

    /** sales, marketing, ops, finance, hr, product, research, custom */
    private String category;

    @Builder.Default
    private List<CellTemplate> cells = new ArrayList<>();

    @Builder.Default
    private List<TemplateVariable> variables = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CellTemplate {
        @Builder.Default
        private String type = "command";
        private String title;
        private String content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TemplateVariable {
        private String name;
        /** text, number, select, date */
        @Builder.Default
        private String type = "text";
        private boolean required;
        private Object defaultValue;
        @Builder.Default
        private List<String> options = new ArrayList<>();
    }
}
