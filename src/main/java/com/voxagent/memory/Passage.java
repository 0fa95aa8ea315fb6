package com.voxagent.memory;

public record Passage(String id, String content, String source, double score) {}
