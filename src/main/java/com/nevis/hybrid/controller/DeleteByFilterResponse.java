package com.nevis.hybrid.controller;

public record DeleteByFilterResponse(int deleted) {}
