package edu.brandeis.cosi103a.arena.votes;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Reads vote timestamps with or without an offset. Timestamps without one, as the
 * arena's earlier logs wrote them, are taken as local time in the given zone.
 */
public class VoteTimeDeserializer extends StdDeserializer<Instant> {

    private final ZoneId localZone;

    public VoteTimeDeserializer() {
        this(ZoneId.systemDefault());
    }

    public VoteTimeDeserializer(ZoneId localZone) {
        super(Instant.class);
        this.localZone = localZone;
    }

    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        String text = parser.getValueAsString();
        if (text == null || text.isBlank()) {
            return null;
        }
        return parse(text.strip(), ctxt);
    }

    private Instant parse(String text, DeserializationContext ctxt) throws IOException {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(localZone).toInstant();
        } catch (DateTimeParseException e) {
            throw ctxt.weirdStringException(text, Instant.class, e.getMessage());
        }
    }
}
