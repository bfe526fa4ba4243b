package io.perfdash.core.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.datatype.jsr310.ser.LocalDateTimeSerializer;

import java.time.LocalDateTime;

/**
 * Shared Jackson setup: java.time support with timestamps written in the
 * canonical {@code yyyy-MM-dd HH:mm:ss} form, plus the fraction of a second
 * when there is one.
 */
public final class JsonSupport {

    private JsonSupport() {}

    public static ObjectMapper newMapper() {
        JavaTimeModule timeModule = new JavaTimeModule();
        timeModule.addSerializer(LocalDateTime.class, new LocalDateTimeSerializer(Timestamps.CANONICAL));
        return new ObjectMapper()
                .registerModule(timeModule)
                .registerModule(new Jdk8Module())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
