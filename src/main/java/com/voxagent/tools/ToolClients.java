package com.voxagent.tools;

import com.voxagent.shared.model.Capabilities;

/**
 * Source of tool handles for one session. Each session gets its own instance, so
 * tests can substitute stubs and sessions never share client state.
 */
public interface ToolClients {

    Tool retrieval(String agentId, Capabilities.RetrievalCapability capability);

    Tool weather(Capabilities.WeatherCapability capability);

    Tool webSearch(Capabilities.WebSearchCapability capability);
}
