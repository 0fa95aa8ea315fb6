package com.voxagent.providers;

import java.util.Map;

public record ChatResponse(String model, String content, Map<String, Integer> usage) {

    public ChatResponse(String content, Map<String, Integer> usage) {
        this(null, content, usage);
    }
}
