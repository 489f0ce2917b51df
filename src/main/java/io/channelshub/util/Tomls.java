package io.channelshub.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

/**
 * Shared TOML mappers. Keys are snake_case in files and camelCase on records.
 */
public final class Tomls {
    private static final TomlMapper MAPPER = createMapper();
    private static final TomlMapper WRITER = createWriter();

    private Tomls() {
    }

    public static TomlMapper mapper() {
        return MAPPER;
    }

    /**
     * Mapper for writing files: null fields are left out instead of rendered.
     */
    public static TomlMapper writer() {
        return WRITER;
    }

    private static TomlMapper createMapper() {
        TomlMapper mapper = new TomlMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static TomlMapper createWriter() {
        TomlMapper mapper = createMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }
}
