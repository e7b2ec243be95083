package com.williamcallahan.cinema_lookup.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheRecordTest {

    private static final Instant NOW = Instant.parse("2030-01-01T00:00:00Z");
    private static final String SYNOPSIS = "Berlijn, april 1945. In de bunker onder de Rijkskanselarij beleeft "
        + "Hitlers jonge secretaresse de laatste dagen van het Derde Rijk van dichtbij mee.";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void foundRecordTakesCandidateFieldsAndFallsBackToQuery() {
        LookupQuery query = LookupQuery.of("Downfall", 2004, null, "tt0363163");
        Candidate candidate = Candidate.builder()
            .title("Der Untergang")
            .description(SYNOPSIS)
            .genres(List.of("Drama"))
            .build();

        CacheRecord record = CacheRecord.found(query, candidate, LookupMethod.TMDB_ALT, null, NOW);

        assertEquals("vpro-downfall-2004-tt0363163-m", record.lookupKey());
        assertEquals("Der Untergang", record.title());
        assertEquals(2004, record.year());
        assertEquals("tt0363163", record.externalId());
        assertEquals(MediaType.FILM, record.mediaType());
        assertEquals(NOW, record.lastAccessedAt());
        assertTrue(record.isFound());
        assertTrue(record.isStructurallyValid());
    }

    @Test
    void notFoundRecordCarriesNoDescription() {
        CacheRecord record = CacheRecord.notFound(LookupQuery.of("Onbekend", null, MediaType.SERIES, null), "tt1234567", NOW);

        assertFalse(record.isFound());
        assertNull(record.description());
        assertNull(record.lookupMethod());
        assertEquals("tt1234567", record.discoveredExternalId());
        assertTrue(record.isStructurallyValid());
    }

    @Test
    void statusAndDescriptionMustAgree() {
        CacheRecord valid = CacheRecord.notFound(LookupQuery.of("Onbekend", null, null, null), null, NOW);
        CacheRecord notFoundWithText = new CacheRecord(valid.lookupKey(), "Onbekend", null, SYNOPSIS, null, null,
            null, null, null, null, MediaType.FILM, CacheStatus.NOT_FOUND, null, null, NOW, NOW);
        CacheRecord foundWithoutText = new CacheRecord(valid.lookupKey(), "Onbekend", null, " ", null, null,
            null, null, null, null, MediaType.FILM, CacheStatus.FOUND, LookupMethod.WEB, null, NOW, NOW);

        assertFalse(notFoundWithText.isStructurallyValid());
        assertFalse(foundWithoutText.isStructurallyValid());
        assertEquals(List.of(), foundWithoutText.genres());
    }

    @Test
    void serializesWithSnakeCaseNamesAndLowercaseEnums() throws Exception {
        CacheRecord record = CacheRecord.found(LookupQuery.of("Der Untergang", 2004, null, null),
            Candidate.builder().title("Der Untergang").description(SYNOPSIS).contentRating("16").build(),
            LookupMethod.POMS, null, NOW);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(record));

        assertEquals("vpro-der-untergang-2004-none-m", json.path("lookup_key").asText());
        assertEquals("found", json.path("status").asText());
        assertEquals("poms", json.path("lookup_method").asText());
        assertEquals("film", json.path("media_type").asText());
        assertEquals("16", json.path("content_rating").asText());
        assertEquals("2030-01-01T00:00:00Z", json.path("fetched_at").asText());
        assertFalse(json.has("discovered_external_id"));
        assertFalse(json.has("found"));
        assertEquals(record, objectMapper.readValue(objectMapper.writeValueAsString(record), CacheRecord.class));
    }
}
