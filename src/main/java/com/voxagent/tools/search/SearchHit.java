package com.voxagent.tools.search;

public record SearchHit(String title, String url, String content) {}
