package me.golemcore.host.tools;

import me.golemcore.host.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalculatorToolTest {

    private CalculatorTool tool;

    @BeforeEach
    void setUp() {
        tool = new CalculatorTool();
    }

    @Test
    void shouldDescribeAddAndSubtract() {
        assertEquals("calculator", tool.getToolId());
        assertEquals(2, tool.getDescriptor().getCapabilities().size());
        assertTrue(tool.getDescriptor().capability("add").isPresent());
        assertTrue(tool.getDescriptor().capability("subtract").isPresent());
    }

    @Test
    void shouldAddNumbers() {
        ToolResult result = tool.execute("add", Map.of("a", 2, "b", 3)).join();

        assertTrue(result.isSuccess());
        assertEquals("5", result.getOutput());
        assertEquals(Map.of("result", 5.0), result.getData());
    }

    @Test
    void shouldSubtractDecimalsAndNumericStrings() {
        ToolResult result = tool.execute("subtract", Map.of("a", "10.5", "b", 0.25)).join();

        assertTrue(result.isSuccess());
        assertEquals("10.25", result.getOutput());
    }

    @Test
    void shouldFailForNonNumericOperand() {
        ToolResult result = tool.execute("add", Map.of("a", "two", "b", 3)).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("must be numbers"));
    }

    @Test
    void shouldFailForUnknownCapability() {
        ToolResult result = tool.execute("multiply", Map.of("a", 2, "b", 3)).join();

        assertFalse(result.isSuccess());
    }
}
