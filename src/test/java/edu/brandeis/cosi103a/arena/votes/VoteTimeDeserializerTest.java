package edu.brandeis.cosi103a.arena.votes;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class VoteTimeDeserializerTest {

    private static ObjectMapper mapperIn(ZoneId zone) {
        SimpleModule module = new SimpleModule();
        module.addDeserializer(Instant.class, new VoteTimeDeserializer(zone));
        return new ObjectMapper().registerModule(module);
    }

    @Test
    void withoutOffset_usesLocalZone() throws Exception {
        Instant utc = mapperIn(ZoneId.of("UTC")).readValue("\"2024-09-25T10:15:30.123456\"", Instant.class);
        Instant boston = mapperIn(ZoneId.of("America/New_York"))
            .readValue("\"2024-09-25T10:15:30.123456\"", Instant.class);

        assertEquals(Instant.parse("2024-09-25T10:15:30.123456Z"), utc);
        assertEquals(Instant.parse("2024-09-25T14:15:30.123456Z"), boston);
    }

    @Test
    void withOffset_ignoresLocalZone() throws Exception {
        ObjectMapper mapper = mapperIn(ZoneId.of("America/New_York"));

        assertEquals(Instant.parse("2024-05-01T10:15:30Z"),
            mapper.readValue("\"2024-05-01T10:15:30Z\"", Instant.class));
        assertEquals(Instant.parse("2024-05-01T08:15:30Z"),
            mapper.readValue("\"2024-05-01T10:15:30+02:00\"", Instant.class));
    }

    @Test
    void garbage_isRejected() {
        assertThrows(InvalidFormatException.class,
            () -> mapperIn(ZoneId.of("UTC")).readValue("\"not a time\"", Instant.class));
    }
}
