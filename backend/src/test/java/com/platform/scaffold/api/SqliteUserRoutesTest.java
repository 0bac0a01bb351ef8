package com.platform.scaffold.api;

import com.platform.scaffold.persistence.DatabaseUrl;
import com.platform.scaffold.persistence.PersistenceGateway;
import com.platform.scaffold.persistence.repository.UserJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
    "API_KEYS=",
    "API_TOKENS=",
    "DATABASE_URL=sqlite:///:memory:"
})
class SqliteUserRoutesTest {

    @Autowired MockMvc mvc;
    @Autowired UserJpaRepository userRepository;
    @Autowired PersistenceGateway persistenceGateway;
    @Autowired DatabaseUrl databaseUrl;

    @BeforeEach
    void clearUsers() {
        userRepository.deleteAll();
    }

    @Test
    void sqliteUrlSelectsTheSqliteDriver() {
        assertEquals("jdbc:sqlite::memory:", databaseUrl.jdbcUrl());
        assertEquals("sqlite", databaseUrl.system());
        assertDoesNotThrow(persistenceGateway::initializeSchema);
    }

    @Test
    void usersAreStoredAndListed() throws Exception {
        mvc.perform(post("/v1/users/").contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"lite@example.com\",\"username\":\"lite\",\"full_name\":\"Lite User\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").isNumber())
            .andExpect(jsonPath("$.is_active").value(true));

        long id = userRepository.findAll().get(0).getId();
        mvc.perform(get("/v1/users/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.username").value("lite"));

        mvc.perform(get("/v1/users"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void duplicateUserIsRejected() throws Exception {
        String body = "{\"email\":\"same@example.com\",\"username\":\"same\"}";
        mvc.perform(post("/v1/users/").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated());

        mvc.perform(post("/v1/users/").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest());
    }
}
