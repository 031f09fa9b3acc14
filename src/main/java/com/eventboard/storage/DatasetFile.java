package com.eventboard.storage;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class DatasetFile {
    public final String name;
    public final Path path;
    public final long sizeBytes;
    public final Instant modifiedAt;
}
