package com.nevis.hybrid.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record InsertDocumentsRequest(
    @NotEmpty
    List<@Valid DocumentRequest> documents
) {}
