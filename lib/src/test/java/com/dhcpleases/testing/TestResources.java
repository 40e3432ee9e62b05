package com.dhcpleases.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class TestResources {

    private TestResources() {}

    private static final Path CLASSPATH_CACHE_DIR = initClasspathCacheDir();

    /** Copies a classpath resource to a temporary file so it can be loaded by path. */
    public static Path resolveResource(String resourceName) throws IOException {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = open(normalized)) {
            Path target = CLASSPATH_CACHE_DIR.resolve(normalized).normalize();
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
            return target;
        }
    }

    public static String read(String resourceName) throws IOException {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = open(normalized)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static InputStream open(String normalized) throws IOException {
        InputStream in = TestResources.class.getClassLoader().getResourceAsStream(normalized);
        if (in == null) {
            throw new IOException("Missing classpath resource: " + normalized);
        }
        return in;
    }

    private static Path initClasspathCacheDir() {
        try {
            Path dir = Files.createTempDirectory("dhcpleases_test_resources");
            dir.toFile().deleteOnExit();
            return dir;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create classpath cache directory", ex);
        }
    }
}
