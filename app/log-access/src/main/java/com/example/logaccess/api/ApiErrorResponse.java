/*
 * Where: app/log-access API
 * What: Error body shared by controllers and security filters
 * Why: Every failure has the same shape whichever layer rejects it
 */
package com.example.logaccess.api;

public record ApiErrorResponse(String code, String message) {}
