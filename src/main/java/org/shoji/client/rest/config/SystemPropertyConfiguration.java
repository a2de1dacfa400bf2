package org.shoji.client.rest.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p>Uses {@link System#getProperty(String)} to retrieve configuration values.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * System.setProperty("shoji.client.responseTimeout", "60");
 *
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * String timeout = config.get("shoji.client.responseTimeout");
 * }</pre>
 */
public class SystemPropertyConfiguration implements ClientConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
