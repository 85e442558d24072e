package org.waypoint.configuration;

import lombok.extern.slf4j.Slf4j;
import org.waypoint.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Slf4j
public class ConfigurationManager {

    static final String DEFAULT_RESOURCE = "waypoint.properties";

    private static ConfigurationManager INSTANCE;
    private final Properties properties;

    ConfigurationManager(String resource) {
        properties = new Properties();

        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                log.error("Configuration resource not found on classpath: {}", resource);
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            properties.load(input);
        } catch (IOException e) {
            log.error("Error loading configuration resource: {}", resource, e);
            throw new ConfigurationException("Error loading configuration resource.", e);
        }
    }

    public static synchronized ConfigurationManager getINSTANCE() {
        if (INSTANCE == null) {
            INSTANCE = new ConfigurationManager(DEFAULT_RESOURCE);
        }

        return INSTANCE;
    }

    /**
     * Loads the given properties file on top of the bundled defaults.
     */
    public static synchronized void overrideProperties(String filePath) {
        getINSTANCE().load(filePath);
    }

    void load(String filePath) {
        try (FileInputStream input = new FileInputStream(filePath)) {
            properties.load(input);
            log.info("Configuration overridden from {}", filePath);
        } catch (FileNotFoundException e) {
            log.error("Configuration file not found: {}", filePath, e);
            throw new ConfigurationException("Configuration file not found.", e);
        } catch (IOException e) {
            log.error("Error loading configuration file: {}", filePath, e);
            throw new ConfigurationException("Error loading configuration file.", e);
        }
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.warn("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer format for property: {}", key, e);
                throw new ConfigurationException("Invalid integer format for property: " + key, e);
            }
        } else {
            log.info("Using default value for property: {}", key);
        }
        return defaultValue;
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.info("Using default value for property: {}", key);
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

}
