/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a {@link ProxyConfiguration} from YAML.
 */
public class ConfigParser {

    private static final ObjectMapper MAPPER = createObjectMapper();

    public ProxyConfiguration parseConfiguration(String configuration) throws ConfigException {
        try {
            return validated(MAPPER.readValue(configuration, ProxyConfiguration.class));
        }
        catch (JsonProcessingException e) {
            throw new ConfigException("Couldn't parse configuration: " + e.getOriginalMessage(), e);
        }
    }

    public ProxyConfiguration parseConfiguration(InputStream configuration) throws ConfigException {
        try {
            return validated(MAPPER.readValue(configuration, ProxyConfiguration.class));
        }
        catch (IOException e) {
            throw new ConfigException("Couldn't parse configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the configuration of a single server group.
     */
    public GroupConfig parseGroupConfig(String configuration) throws ConfigException {
        GroupConfig config;
        try {
            config = MAPPER.readValue(configuration, GroupConfig.class);
        }
        catch (JsonProcessingException e) {
            throw new ConfigException("Couldn't parse server group configuration: " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("Couldn't parse server group configuration: empty document");
        }
        config.validate();
        return config;
    }

    private static ProxyConfiguration validated(ProxyConfiguration parsed) throws ConfigException {
        // an empty document parses to null
        ProxyConfiguration configuration = parsed == null ? new ProxyConfiguration(null) : parsed;
        configuration.validate();
        return configuration;
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new SimpleModule("promfed-durations").addDeserializer(Duration.class, new PromDurationDeserializer()))
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }
}
