package io.nextrun.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import io.nextrun.client.api.JacksonTimeModule;

public final class ScheduleJson
{
    private ScheduleJson()
    { }

    public static ObjectMapper objectMapper()
    {
        return JsonMapper.builder()
            .addModule(new GuavaModule())
            .addModule(new JacksonTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
