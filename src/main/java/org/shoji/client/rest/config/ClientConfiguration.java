package org.shoji.client.rest.config;

/**
 * Configuration interface for client settings.
 *
 * <p>Abstracts configuration sources (system properties, environment variables, files, etc.)
 * to enable testability and flexibility.</p>
 *
 * <p><b>Configuration keys:</b></p>
 * <ul>
 *   <li>shoji.client.connectionTimeout - seconds to wait for a pooled connection</li>
 *   <li>shoji.client.responseTimeout - seconds to wait for a response</li>
 *   <li>shoji.client.userAgent - User-Agent header sent with every request</li>
 *   <li>shoji.client.defaultContentType - Accept header sent with every request</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * SessionSettings settings = SessionSettings.fromConfiguration(config);
 * }</pre>
 */
public interface ClientConfiguration {

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
