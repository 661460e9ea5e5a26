package me.golemcore.host.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.host.domain.component.ToolComponent;
import me.golemcore.host.domain.model.ToolCapability;
import me.golemcore.host.domain.model.ToolDescriptor;
import me.golemcore.host.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Basic arithmetic on two operands.
 *
 * <p>
 * Capabilities: {@code add} and {@code subtract}, both taking numeric
 * parameters {@code a} and {@code b}. Operands may be JSON numbers or numeric
 * strings. The output is the plain decimal result, e.g. {@code "5"} for 2 + 3.
 */
@Component
public class CalculatorTool implements ToolComponent {

    static final String TOOL_ID = "calculator";

    private static final List<ToolCapability.ToolParameter> OPERANDS = List.of(
            ToolCapability.ToolParameter.required("a", "number", "First operand"),
            ToolCapability.ToolParameter.required("b", "number", "Second operand"));

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .id(TOOL_ID)
                .name("Calculator")
                .description("Performs basic arithmetic operations")
                .version("1.0.0")
                .categories(List.of("math"))
                .capabilities(List.of(
                        ToolCapability.builder()
                                .name("add")
                                .description("Add two numbers")
                                .parameters(OPERANDS)
                                .returnType("number")
                                .build(),
                        ToolCapability.builder()
                                .name("subtract")
                                .description("Subtract the second number from the first")
                                .parameters(OPERANDS)
                                .returnType("number")
                                .build()))
                .enabled(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(String capability, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            BigDecimal a = operand(parameters, "a");
            BigDecimal b = operand(parameters, "b");
            if (a == null || b == null) {
                return ToolResult.failure("Parameters 'a' and 'b' must be numbers");
            }

            BigDecimal result = switch (capability) {
            case "add" -> a.add(b);
            case "subtract" -> a.subtract(b);
            default -> null;
            };
            if (result == null) {
                return ToolResult.failure("Unknown capability: " + capability);
            }

            String output = result.stripTrailingZeros().toPlainString();
            return ToolResult.success(output, Map.of("result", result.doubleValue()));
        });
    }

    private static BigDecimal operand(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
