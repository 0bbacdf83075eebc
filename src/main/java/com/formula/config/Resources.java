package com.formula.config;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

/**
 * Resolves configuration and data paths. Supports the {@code classpath:} prefix.
 */
public final class Resources {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private Resources() {
    }

    public static Resource resolve(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }
}
