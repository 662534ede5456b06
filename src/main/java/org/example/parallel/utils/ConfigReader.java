package org.example.parallel.utils;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.Properties;

@Slf4j
public final class ConfigReader {
    private static final Properties properties = new Properties();
    private static final Dotenv dotenv;

    static {
        try (InputStream is = ConfigReader.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (is != null) {
                properties.load(is);
            }
        } catch (Exception e) {
            log.warn("config.properties could not be read, using defaults: {}", e.getMessage());
        }

        dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
    }

    private ConfigReader() {}

    /**
     * Lookup order:
     * 1. OS environment variable (key upper-cased, dots replaced by underscores)
     * 2. System property (e.g. mvn test -Dkey=value)
     * 3. .env file (local development, ignored when absent)
     * 4. config.properties
     * 5. default value
     */
    public static String get(String key, String defaultValue) {
        String envKey = toEnvKey(key);

        String envValue = System.getenv(envKey);
        if (envValue != null) return envValue;

        String sysProp = System.getProperty(key);
        if (sysProp != null) return sysProp;

        String dotenvValue = dotenv.get(envKey, null);
        if (dotenvValue != null) return dotenvValue;

        return properties.getProperty(key, defaultValue);
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static double getDouble(String key, double defaultValue) {
        String value = get(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid decimal for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    static String toEnvKey(String key) {
        return key.toUpperCase().replace(".", "_");
    }
}
