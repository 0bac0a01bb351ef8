package com.platform.scaffold.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.scaffold.config.ConditionalOnFeature;
import com.platform.scaffold.config.Feature;
import com.platform.scaffold.persistence.UserService;
import com.platform.scaffold.persistence.entity.UserEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for users. Only registered when DATABASE_URL is set.
 */
@RestController
@RequestMapping("/v1/users")
@ConditionalOnFeature(Feature.PERSISTENCE)
public class UserController {
    
    private final UserService userService;
    
    public UserController(UserService userService) {
        this.userService = userService;
    }
    
    /**
     * Create a user. Email and username must both be unused.
     */
    @PostMapping({"", "/"})
    @ResponseStatus(HttpStatus.CREATED)
    public UserDTO createUser(@Valid @RequestBody UserCreateRequest request) {
        UserEntity created = userService.create(
            request.email(),
            request.username(),
            request.fullName(),
            request.active() == null || request.active());
        return UserDTO.from(created);
    }
    
    @GetMapping("/{user_id}")
    public UserDTO getUser(@PathVariable("user_id") long userId) {
        return UserDTO.from(userService.getById(userId));
    }
    
    /**
     * List users ordered by id.
     */
    @GetMapping({"", "/"})
    public List<UserDTO> listUsers(
            @RequestParam(value = "skip", defaultValue = "0") int skip,
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return userService.list(skip, limit).stream()
            .map(UserDTO::from)
            .toList();
    }
    
    public record UserCreateRequest(
        @NotBlank @Email @Size(max = 255) String email,
        @NotBlank @Size(max = 100) String username,
        @JsonProperty("full_name") @Size(max = 255) String fullName,
        @JsonProperty("is_active") Boolean active
    ) {}
    
    public record UserDTO(
        Long id,
        String email,
        String username,
        @JsonProperty("full_name") String fullName,
        @JsonProperty("is_active") boolean active
    ) {
        static UserDTO from(UserEntity entity) {
            return new UserDTO(entity.getId(), entity.getEmail(), entity.getUsername(),
                entity.getFullName(), entity.isActive());
        }
    }
}
