package me.golemcore.host.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A named function a tool can perform, with its parameter contract.
 */
@Data
@Builder
public class ToolCapability {

    private String name;
    private String description;

    @Builder.Default
    private List<ToolParameter> parameters = List.of();

    private String returnType;

    public List<String> requiredParameterNames() {
        return parameters.stream()
                .filter(ToolParameter::isRequired)
                .map(ToolParameter::getName)
                .toList();
    }

    @Data
    @Builder
    public static class ToolParameter {
        private String name;
        private String description;
        private String type;
        private boolean required;
        private Object defaultValue;

        public static ToolParameter required(String name, String type, String description) {
            return ToolParameter.builder()
                    .name(name)
                    .type(type)
                    .description(description)
                    .required(true)
                    .build();
        }

        public static ToolParameter optional(String name, String type, String description) {
            return ToolParameter.builder()
                    .name(name)
                    .type(type)
                    .description(description)
                    .required(false)
                    .build();
        }
    }
}
