package com.ngramengine.query;

import java.util.List;

public record SearchResult<I>(
        List<SearchHit<I>> hits,
        int totalMatches,
        long elapsedMs,
        String query
) {
}
