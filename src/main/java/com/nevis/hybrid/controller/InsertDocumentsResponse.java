package com.nevis.hybrid.controller;

import java.util.List;

public record InsertDocumentsResponse(List<String> ids) {}
