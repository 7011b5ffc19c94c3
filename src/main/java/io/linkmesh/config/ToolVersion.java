package io.linkmesh.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public final class ToolVersion {
    public static final String UNKNOWN = "undefined";
    private static final String RESOURCE = "/linkmesh-version.properties";

    private ToolVersion() {
    }

    public static String current() {
        try (InputStream in = ToolVersion.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return UNKNOWN;
            }
            Properties props = new Properties();
            props.load(in);
            String version = props.getProperty("version", "").trim();
            // Unfiltered resource when running from an IDE without the Maven resources phase.
            if (version.isEmpty() || version.startsWith("${")) {
                return UNKNOWN;
            }
            return version;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read tool version resource", e);
        }
    }
}
