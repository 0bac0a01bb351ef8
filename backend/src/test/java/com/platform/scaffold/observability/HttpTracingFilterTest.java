package com.platform.scaffold.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HttpTracingFilterTest {

    @Test
    void spanNamesCollapseIdentifiers() {
        assertEquals("/v1/users/{id}", HttpTracingFilter.getSpanName("/v1/users/42"));
        assertEquals("/items/{id}", HttpTracingFilter.getSpanName("/items/7"));
        assertEquals("/v1/protected/data", HttpTracingFilter.getSpanName("/v1/protected/data"));
        assertEquals("/things/{id}", HttpTracingFilter.getSpanName("/things/123e4567-e89b-12d3-a456-426614174000"));
    }
}
