package com.example.logaccess.model;

import java.nio.file.Path;

/** A regular file that sits directly inside the storage directory. */
public record LogFile(String name, Path path, long size) {}
