package com.hellokaton.lumen.config;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

/**
 * A directory served under a path prefix.
 */
@Getter
@AllArgsConstructor
public class StaticFilesConfig {

    private final String path;
    private final Path directory;

}
