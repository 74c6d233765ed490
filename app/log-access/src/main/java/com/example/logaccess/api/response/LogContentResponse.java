package com.example.logaccess.api.response;

public record LogContentResponse(String file, String content) {}
