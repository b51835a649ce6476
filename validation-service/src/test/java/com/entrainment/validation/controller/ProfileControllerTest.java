package com.entrainment.validation.controller;

import com.entrainment.common.exception.UnsafeInputException;
import com.entrainment.common.profile.CompatibilityScore;
import com.entrainment.validation.logger.ValidationFlowLogger;
import com.entrainment.validation.service.ValidationDispatchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ProfileController.class)
@Import({ ValidationFlowLogger.class, ApiExceptionHandler.class })
class ProfileControllerTest {

    @Autowired
    private WebTestClient client;

    @MockBean
    private ValidationDispatchService dispatchService;

    @Test
    @DisplayName("POST /compatibility → sub-scores")
    void compatibility() {
        when(dispatchService.compatibility(any(), any()))
            .thenReturn(Mono.just(new CompatibilityScore(0.97, 1.0, 1.0, 1.0, 1.0, 0.8)));

        client.post().uri("/api/v1/profiles/compatibility")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"first\": {\"schema_version\": 2}, \"second\": {\"schema_version\": 2}}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.overall").isEqualTo(0.97)
            .jsonPath("$.safetyCompatibility").isEqualTo(0.8);
    }

    @Test
    @DisplayName("POST /default → profile document passed through as JSON")
    void createDefault() {
        when(dispatchService.createDefaultProfile(eq("Ada"), eq("beginner")))
            .thenReturn(Mono.just("{\"schema_version\": 2, \"name\": \"Ada\"}"));

        client.post().uri("/api/v1/profiles/default")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"name\": \"Ada\", \"experienceLevel\": \"beginner\"}")
            .exchange()
            .expectStatus().isOk()
            .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
            .expectBody()
            .jsonPath("$.schema_version").isEqualTo(2)
            .jsonPath("$.name").isEqualTo("Ada");
    }

    @Test
    @DisplayName("unsafe name → 400 from the sanitizer")
    void unsafeName() {
        when(dispatchService.createDefaultProfile(any(), any()))
            .thenReturn(Mono.error(new UnsafeInputException("name", "Potentially dangerous content detected")));

        client.post().uri("/api/v1/profiles/default")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"name\": \"<script>\", \"experienceLevel\": \"beginner\"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.component").isEqualTo("InputSanitizer");
    }
}
