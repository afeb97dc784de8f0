package com.example.datalake.kbsearch.service;

import java.util.Collection;
import java.util.Map;

public interface DocumentNameResolver {

    /**
     * File names keyed by document id. Soft-deleted and unknown ids are absent from the map.
     */
    Map<String, String> getNames(Collection<String> documentIds);
}
