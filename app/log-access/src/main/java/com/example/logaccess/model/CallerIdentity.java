package com.example.logaccess.model;

public record CallerIdentity(String username) {}
