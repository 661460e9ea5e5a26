package me.golemcore.host.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Point-in-time usage of the memory registry, per category and overall.
 */
@Data
@Builder
public class MemoryStatus {

    private long usedBytes;
    private long quotaBytes;
    private int handleCount;
    private Map<MemoryCategory, CategoryUsage> categories;

    public CategoryUsage category(MemoryCategory category) {
        return categories.get(category);
    }

    public double usagePercentage() {
        return quotaBytes == 0 ? 0.0 : (usedBytes * 100.0) / quotaBytes;
    }

    @Data
    @Builder
    public static class CategoryUsage {
        private long usedBytes;
        private long quotaBytes;
        private int handleCount;
    }
}
