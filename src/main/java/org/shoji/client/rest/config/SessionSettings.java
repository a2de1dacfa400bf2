package org.shoji.client.rest.config;

import lombok.Data;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Settings of an {@link org.shoji.client.rest.service.HttpSession}.
 */
@Data
public class SessionSettings {

    public static final String PREFIX = "shoji.client.";
    public static final String CONNECTION_TIMEOUT = PREFIX + "connectionTimeout";
    public static final String RESPONSE_TIMEOUT = PREFIX + "responseTimeout";
    public static final String USER_AGENT = PREFIX + "userAgent";
    public static final String DEFAULT_CONTENT_TYPE = PREFIX + "defaultContentType";

    static final int DEFAULT_CONNECTION_TIMEOUT = 30;
    static final int DEFAULT_RESPONSE_TIMEOUT = 30;
    static final String DEFAULT_USER_AGENT = "shoji-client";

    /** Seconds */
    private int connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    /** Seconds */
    private int responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
    private String userAgent = DEFAULT_USER_AGENT;
    // sent as Accept
    private String defaultContentType = "application/json";

    /**
     * Reads settings from a configuration source; missing or non-numeric values keep their
     * defaults.
     *
     * @param configuration Configuration source
     * @return Settings
     */
    public static SessionSettings fromConfiguration(ClientConfiguration configuration) {
        SessionSettings settings = new SessionSettings();
        settings.setConnectionTimeout(
                NumberUtils.toInt(configuration.get(CONNECTION_TIMEOUT), DEFAULT_CONNECTION_TIMEOUT));
        settings.setResponseTimeout(
                NumberUtils.toInt(configuration.get(RESPONSE_TIMEOUT), DEFAULT_RESPONSE_TIMEOUT));
        settings.setUserAgent(configuration.get(USER_AGENT, DEFAULT_USER_AGENT));
        settings.setDefaultContentType(configuration.get(DEFAULT_CONTENT_TYPE, settings.getDefaultContentType()));
        return settings;
    }
}
