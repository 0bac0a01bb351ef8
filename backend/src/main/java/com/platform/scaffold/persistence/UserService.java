package com.platform.scaffold.persistence;

import com.platform.scaffold.error.DuplicateResourceException;
import com.platform.scaffold.error.ResourceNotFoundException;
import com.platform.scaffold.error.ValidationException;
import com.platform.scaffold.persistence.entity.UserEntity;
import com.platform.scaffold.persistence.repository.UserJpaRepository;
import com.platform.scaffold.security.SecurityAuditLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;

import java.util.List;

/**
 * User operations. Each call runs in its own storage session.
 */
@Slf4j
public class UserService {
    
    public static final int MAX_LIMIT = 1000;
    private static final String RESOURCE = "User";
    private static final String UNIQUE_FIELDS = "email or username";
    
    private final PersistenceGateway gateway;
    private final UserJpaRepository repository;
    private final SecurityAuditLogger auditLogger;
    
    public UserService(PersistenceGateway gateway, UserJpaRepository repository, SecurityAuditLogger auditLogger) {
        this.gateway = gateway;
        this.repository = repository;
        this.auditLogger = auditLogger;
    }
    
    /**
     * Stores a new user.
     *
     * @throws DuplicateResourceException if the email or username is taken, including
     *         when a concurrent insert wins the unique constraint
     */
    public UserEntity create(String email, String username, String fullName, boolean active) {
        try {
            UserEntity created = gateway.inSession("user.create", () -> {
                if (repository.existsByEmailOrUsername(email, username)) {
                    throw new DuplicateResourceException(RESOURCE, UNIQUE_FIELDS);
                }
                return repository.save(UserEntity.builder()
                    .email(email)
                    .username(username)
                    .fullName(fullName)
                    .active(active)
                    .build());
            });
            auditLogger.logUserCreate(String.valueOf(created.getId()), username, true, null);
            log.info("Created user {} ({})", created.getId(), username);
            return created;
        } catch (DuplicateResourceException e) {
            auditLogger.logUserCreate(null, username, false, e.getMessage());
            throw e;
        } catch (DataIntegrityViolationException e) {
            auditLogger.logUserCreate(null, username, false, "unique constraint violation");
            throw new DuplicateResourceException(RESOURCE, UNIQUE_FIELDS, e);
        }
    }
    
    public UserEntity getById(long id) {
        return gateway.inSession("user.get", () -> 
            repository.findById(id).orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id)));
    }
    
    /**
     * Users ordered by id, {@code limit} rows starting at row {@code skip}.
     */
    public List<UserEntity> list(int skip, int limit) {
        if (skip < 0) {
            throw new ValidationException("skip", skip, "must be greater than or equal to 0");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit", limit, "must be between 1 and " + MAX_LIMIT);
        }
        return gateway.inSession("user.list", () -> 
            repository.findAllBy(new OffsetPageRequest(skip, limit, Sort.by("id"))).getContent());
    }
}
