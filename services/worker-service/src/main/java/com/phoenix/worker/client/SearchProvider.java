package com.phoenix.worker.client;

import java.util.List;

public interface SearchProvider {

    /**
     * @return hits of one result page, ordered by rank
     */
    List<SearchHit> search(String query, int page, int resultsPerPage);
}
