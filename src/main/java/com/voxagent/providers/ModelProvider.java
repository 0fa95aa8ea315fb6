package com.voxagent.providers;

public interface ModelProvider {
    String id();
    ChatResponse chat(ChatRequest request);
}
