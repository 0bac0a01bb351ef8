package com.platform.scaffold.error;

import com.platform.scaffold.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class GlobalExceptionHandlerTest {

    private MetricsRegistry metrics;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry(new SimpleMeterRegistry());
        mvc = MockMvcBuilders.standaloneSetup(new FailingController())
            .setControllerAdvice(new GlobalExceptionHandler(metrics))
            .build();
    }

    @Test
    void missingCredentialIsChallenged() throws Exception {
        mvc.perform(get("/fail/missing"))
            .andExpect(status().isUnauthorized())
            .andExpect(header().string("WWW-Authenticate", "Bearer"))
            .andExpect(jsonPath("$.code").value("SC-200"))
            .andExpect(jsonPath("$.detail").value("Missing bearer token"));
    }

    @Test
    void invalidCredentialIsForbidden() throws Exception {
        mvc.perform(get("/fail/invalid"))
            .andExpect(status().isForbidden())
            .andExpect(header().doesNotExist("WWW-Authenticate"))
            .andExpect(jsonPath("$.code").value("SC-201"))
            .andExpect(jsonPath("$.detail").value("Invalid bearer token"));
    }

    @Test
    void unconfiguredAuthIsServerError() throws Exception {
        mvc.perform(get("/fail/unconfigured"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value("SC-903"))
            .andExpect(jsonPath("$.fatal").value(true));
    }

    @Test
    void missingResourceCarriesMetadata() throws Exception {
        mvc.perform(get("/fail/missing-user"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.detail").value("User 42 not found"))
            .andExpect(jsonPath("$.metadata.resourceType").value("User"))
            .andExpect(jsonPath("$.metadata.resourceId").value("42"))
            .andExpect(jsonPath("$.path").value("/fail/missing-user"));
    }

    @Test
    void duplicateIsBadRequest() throws Exception {
        mvc.perform(get("/fail/duplicate"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("SC-311"))
            .andExpect(jsonPath("$.detail").value("User with this email or username already exists"));
    }

    @Test
    void unexpectedErrorIsServerError() throws Exception {
        mvc.perform(get("/fail/unexpected"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value("SC-901"));

        assertEquals(1.0, metrics.getCount("scaffold.errors", "code", "SC-901", "fatal", "true"));
    }

    @Test
    void databaseFailureHidesDriverDetail() throws Exception {
        mvc.perform(get("/fail/database"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value("SC-400"))
            .andExpect(jsonPath("$.detail").value("Database error"))
            .andExpect(content().string(not(containsString("users_secret"))))
            .andExpect(content().string(not(containsString("10.1.2.3"))));

        assertEquals(1.0, metrics.getCount("scaffold.errors", "code", "SC-400", "fatal", "true"));
    }

    @Test
    void wrongMethodIsNotAllowed() throws Exception {
        mvc.perform(post("/fail/missing"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void statusMapping() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.DUPLICATE_RESOURCE));
        assertEquals(HttpStatus.UNAUTHORIZED, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.UNAUTHORIZED));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.FORBIDDEN));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.RESOURCE_NOT_FOUND));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.CONFIGURATION_ERROR));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.AUTH_NOT_CONFIGURED));
    }

    @RestController
    static class FailingController {

        @GetMapping("/fail/missing")
        void missing() {
            throw new MissingCredentialException();
        }

        @GetMapping("/fail/invalid")
        void invalid() {
            throw new InvalidCredentialException();
        }

        @GetMapping("/fail/unconfigured")
        void unconfigured() {
            throw new AuthenticationNotConfiguredException();
        }

        @GetMapping("/fail/missing-user")
        void missingUser() {
            throw new ResourceNotFoundException("User", 42);
        }

        @GetMapping("/fail/duplicate")
        void duplicate() {
            throw new DuplicateResourceException("User", "email or username");
        }

        @GetMapping("/fail/database")
        void database() {
            throw new DataAccessResourceFailureException("Connection to 10.1.2.3:5432 refused",
                new IllegalStateException("relation \"users_secret\" does not exist"));
        }

        @GetMapping("/fail/unexpected")
        void unexpected() {
            throw new IllegalStateException("boom");
        }
    }
}
