package com.voxagent.tasks;

/** One routable piece of a user utterance, bound to exactly one agent. */
public record Task(String query, String agentId, String agentName, int order) {}
