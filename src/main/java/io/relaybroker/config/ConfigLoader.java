package io.relaybroker.config;

import java.io.IOException;
import java.io.InputStream;

public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "broker.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads broker configuration from a YAML file by delegating to {@link BrokerConfig#load(String)}.
     *
     * @param path the path to the broker YAML configuration file
     * @return a populated {@link BrokerConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static BrokerConfig load(final String path) throws IOException {
        return BrokerConfig.load(path);
    }

    /**
     * Loads broker configuration from a classpath resource.
     *
     * @throws IOException if the resource does not exist
     */
    public static BrokerConfig loadResource(final String resource) throws IOException {
        try (final InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("config resource not found on classpath: " + resource);
            }
            return BrokerConfig.load(in);
        }
    }

    /**
     * Uses the file at {@code path} when given, else the bundled {@value #DEFAULT_RESOURCE}.
     */
    public static BrokerConfig loadOrDefault(final String path) throws IOException {
        return path != null ? load(path) : loadResource(DEFAULT_RESOURCE);
    }
}
