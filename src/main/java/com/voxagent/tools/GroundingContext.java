package com.voxagent.tools;

import java.util.List;

/**
 * Tool text assembled for one task, with the kinds that actually contributed in
 * concatenation order.
 */
public record GroundingContext(String text, List<ToolKind> contributors) {

    public GroundingContext {
        contributors = List.copyOf(contributors);
    }

    public static GroundingContext empty() {
        return new GroundingContext(null, List.of());
    }

    public boolean isEmpty() {
        return text == null || text.isBlank();
    }
}
