package com.railplan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.InputStream;
import java.io.Reader;
import java.util.HashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of the scheduling components.
 *
 * Validation of individual values is left to the components themselves. An example config file with every parameter
 * is shipped on the classpath, so all configuration parameters are required to avoid any confusion due to merging
 * layers of defaults.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "railplan-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new HashSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators, and must be prefixed with "railplan", e.g. RAILPLAN_MAX_ITERATIONS=20 or
     * java -Drailplan.max.iterations=20. Precedence is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new ScheduleException(ScheduleException.Type.CONFIGURATION,
                    "Could not load configuration properties from " + filename, e);
        }
    }

    protected static Properties propsFromResource (String resourceName) {
        try (InputStream stream = ConfigBase.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw ScheduleException.configuration("Configuration resource not found: " + resourceName);
            }
            Properties properties = new Properties();
            properties.load(stream);
            return properties;
        } catch (java.io.IOException e) {
            throw new ScheduleException(ScheduleException.Type.CONFIGURATION,
                    "Could not load configuration resource " + resourceName, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected long longProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Long.parseLong(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a long: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected double doubleProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Double.parseDouble(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected boolean boolProp (String key) {
        String val = strProp(key);
        if (val != null) {
            // Boolean.parseBoolean will return false for any string other than "true". We want to be more strict.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return false;
    }

    /** Call this after reading all properties to enforce the presence of all configuration options. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw ScheduleException.configuration("You must provide valid values for these configuration properties: "
                    + String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties.
     * Case and separators are normalized to conform to both properties and environment variable conventions.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String)entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String)entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
