/*
 * Where: app/log-access model
 * What: One row of the users_log_api table
 * Why: The key store is owned by an external database and only read here
 */
package com.example.logaccess.model;

public record ApiKeyRecord(String userKey, String login) {}
