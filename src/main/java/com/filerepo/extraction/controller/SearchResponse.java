package com.filerepo.extraction.controller;

import java.util.List;

public record SearchResponse(
    List<SearchMatchItem> matches
) {}
