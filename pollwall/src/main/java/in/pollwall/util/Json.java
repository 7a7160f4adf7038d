package in.pollwall.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper. Wire format is snake_case with ISO-8601 timestamps.
 */
public final class Json {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Writer for the event stream. Leaves out properties marked {@link Views.Viewer}.
     */
    public static final ObjectWriter BROADCAST = MAPPER.writerWithView(Views.Broadcast.class);

    /**
     * Serialization views. Properties without a view are written in every view.
     */
    public static final class Views {
        public interface Broadcast {}

        public interface Viewer {}

        private Views() {}
    }

    private Json() {}
}
