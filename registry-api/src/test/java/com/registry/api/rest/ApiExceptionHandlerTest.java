package com.registry.api.rest;

import com.registry.core.schema.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("An IllegalArgumentException raised past request parsing is a server error")
    void internalIllegalArgumentIsServerError() throws Exception {
        mockMvc.perform(post("/bug"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    @Test
    @DisplayName("A value Jackson cannot bind stays a client error naming the value")
    void unbindableValueIsBadRequest() throws Exception {
        mockMvc.perform(post("/kind")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"decimal\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
            .andExpect(jsonPath("$.message").value("Unknown field type 'decimal'"));
    }

    record KindRequest(FieldType type) {
    }

    @RestController
    static class FailingController {

        @PostMapping("/bug")
        void bug() {
            throw new IllegalArgumentException("engine invariant broken");
        }

        @PostMapping("/kind")
        String kind(@RequestBody KindRequest request) {
            return request.type().wireName();
        }
    }
}
