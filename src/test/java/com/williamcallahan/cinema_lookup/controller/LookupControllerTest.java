package com.williamcallahan.cinema_lookup.controller;

import com.williamcallahan.cinema_lookup.model.CacheRecord;
import com.williamcallahan.cinema_lookup.model.LookupQuery;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.service.ResolutionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class LookupControllerTest {

    private ResolutionOrchestrator mockOrchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockOrchestrator = Mockito.mock(ResolutionOrchestrator.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new LookupController(mockOrchestrator)).build();
    }

    @Test
    void lookupReturnsRecordAsSnakeCaseJson() throws Exception {
        LookupQuery query = LookupQuery.of("Onbekende Film", 2011, MediaType.SERIES, null);
        CacheRecord record = CacheRecord.notFound(query, null, Instant.parse("2030-01-01T00:00:00Z"));
        Mockito.when(mockOrchestrator.resolveAsync("Onbekende Film", 2011, MediaType.SERIES, null))
            .thenReturn(CompletableFuture.completedFuture(record));

        MvcResult result = mockMvc.perform(get("/api/lookup")
                .param("title", "Onbekende Film")
                .param("year", "2011")
                .param("mediaType", "tv"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lookup_key").value("vpro-onbekende-film-2011-none-s"))
            .andExpect(jsonPath("$.status").value("not_found"))
            .andExpect(jsonPath("$.media_type").value("series"))
            .andExpect(jsonPath("$.description").doesNotExist());
    }

    @Test
    void unknownMediaTypeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/lookup").param("title", "Heimat").param("mediaType", "podcast"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid lookup"));
    }

    @Test
    void blankTitleIsBadRequest() throws Exception {
        Mockito.when(mockOrchestrator.resolveAsync(" ", null, MediaType.FILM, null))
            .thenThrow(new IllegalArgumentException("Title must not be blank"));

        mockMvc.perform(get("/api/lookup").param("title", " "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Title must not be blank"));
    }

    @Test
    void failedLookupIsServerError() throws Exception {
        Mockito.when(mockOrchestrator.resolveAsync("Heimat", null, MediaType.FILM, null))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        MvcResult result = mockMvc.perform(get("/api/lookup").param("title", "Heimat"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result)).andExpect(status().isInternalServerError());
    }
}
