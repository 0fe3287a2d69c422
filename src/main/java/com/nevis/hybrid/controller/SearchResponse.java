package com.nevis.hybrid.controller;

import com.nevis.hybrid.model.SearchResult;

import java.util.List;

public record SearchResponse(List<SearchResult> results) {}
