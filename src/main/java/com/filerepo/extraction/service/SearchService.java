package com.filerepo.extraction.service;

import com.filerepo.extraction.controller.SearchResponse;

public interface SearchService {

    SearchResponse searchTenant(String tenantId, String query, Integer topK);

    SearchResponse searchFile(String tenantId, String fileId, String query, Integer topK);
}
