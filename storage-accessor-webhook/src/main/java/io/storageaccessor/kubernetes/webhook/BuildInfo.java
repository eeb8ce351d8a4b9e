/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What was built, as recorded in the packaged metadata file.
 *
 * @param version project version, {@value #UNKNOWN} when the metadata file is absent or unreadable
 */
public record BuildInfo(String version) {

    static final String METADATA_RESOURCE = "META-INF/storage-accessor-metadata.properties";
    static final String VERSION_PROPERTY = "storage-accessor.version";
    static final String UNKNOWN = "unknown";

    private static final Logger LOGGER = LoggerFactory.getLogger(BuildInfo.class);

    public BuildInfo {
        Objects.requireNonNull(version);
    }

    /**
     * @return the build info packaged with this webhook
     */
    public static BuildInfo current() {
        return load(BuildInfo.class.getClassLoader(), METADATA_RESOURCE);
    }

    static BuildInfo load(ClassLoader classLoader, String resourceName) {
        try (InputStream resource = classLoader.getResourceAsStream(resourceName)) {
            if (resource == null) {
                LOGGER.debug("No build metadata at {}", resourceName);
                return new BuildInfo(UNKNOWN);
            }
            Properties properties = new Properties();
            properties.load(resource);
            String version = properties.getProperty(VERSION_PROPERTY, "").strip();
            return new BuildInfo(version.isEmpty() ? UNKNOWN : version);
        }
        catch (IOException e) {
            LOGGER.warn("Failed to read build metadata from {} (ignored)", resourceName, e);
            return new BuildInfo(UNKNOWN);
        }
    }
}
