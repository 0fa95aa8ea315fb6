package com.voxagent.tools.search;

import java.util.List;

/**
 * One web-search backend. Implementations throw on transport or API errors; the
 * calling tool turns those into error results.
 */
public interface SearchProvider {
    String name();
    List<SearchHit> search(String query, int maxResults) throws Exception;
}
