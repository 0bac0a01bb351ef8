package com.platform.scaffold.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Example resource echoing its path and query parameters.
 * Served both unversioned and under /v1.
 */
@RestController
public class ItemController {
    
    @GetMapping({"/items/{item_id}", "/v1/items/{item_id}"})
    public ItemResponse readItem(
            @PathVariable("item_id") int itemId,
            @RequestParam(value = "q", required = false) String q) {
        return new ItemResponse(itemId, q);
    }
    
    public record ItemResponse(
        @JsonProperty("item_id") int itemId,
        String q
    ) {}
}
