package com.voxagent.tools;

/**
 * Tool categories in grounding order: retrieval text always precedes weather,
 * which precedes web-search output.
 */
public enum ToolKind {
    RETRIEVAL("retrieval"),
    WEATHER("weather"),
    WEB_SEARCH("web_search");

    private final String id;

    ToolKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
