package io.nextrun.client.api;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * ISO-8601 local date-times ({@code 2024-01-01T09:00:00}) and times of day ({@code 09:00:00}).
 */
public class JacksonTimeModule
    extends SimpleModule
{
    public JacksonTimeModule()
    {
        super();
        addSerializer(LocalDateTime.class, new LocalDateTimeSerializer());
        addDeserializer(LocalDateTime.class, new LocalDateTimeDeserializer());
        addSerializer(LocalTime.class, new LocalTimeSerializer());
        addDeserializer(LocalTime.class, new LocalTimeDeserializer());
    }

    public static class LocalDateTimeSerializer
            extends JsonSerializer<LocalDateTime>
    {
        private final DateTimeFormatter formatter =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ENGLISH);

        @Override
        public void serialize(LocalDateTime value, JsonGenerator jgen, SerializerProvider provider)
                throws IOException
        {
            jgen.writeString(formatter.format(value));
        }
    }

    public static class LocalDateTimeDeserializer
            extends FromStringDeserializer<LocalDateTime>
    {
        public LocalDateTimeDeserializer()
        {
            super(LocalDateTime.class);
        }

        @Override
        protected LocalDateTime _deserialize(String value, DeserializationContext context)
                throws JsonMappingException
        {
            try {
                return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            }
            catch (DateTimeParseException ex) {
                throw JsonMappingException.from(context, "Invalid ISO local date time format: " + value, ex);
            }
        }
    }

    public static class LocalTimeSerializer
            extends JsonSerializer<LocalTime>
    {
        private final DateTimeFormatter formatter =
            DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ENGLISH);

        @Override
        public void serialize(LocalTime value, JsonGenerator jgen, SerializerProvider provider)
                throws IOException
        {
            jgen.writeString(formatter.format(value));
        }
    }

    public static class LocalTimeDeserializer
            extends FromStringDeserializer<LocalTime>
    {
        public LocalTimeDeserializer()
        {
            super(LocalTime.class);
        }

        @Override
        protected LocalTime _deserialize(String value, DeserializationContext context)
                throws JsonMappingException
        {
            try {
                return LocalTime.parse(value, DateTimeFormatter.ISO_LOCAL_TIME);
            }
            catch (DateTimeParseException ex) {
                throw JsonMappingException.from(context, "Invalid ISO time format: " + value, ex);
            }
        }
    }
}
