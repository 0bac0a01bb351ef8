package com.platform.scaffold.persistence;

import com.platform.scaffold.error.DuplicateResourceException;
import com.platform.scaffold.error.ResourceNotFoundException;
import com.platform.scaffold.error.ValidationException;
import com.platform.scaffold.persistence.entity.UserEntity;
import com.platform.scaffold.persistence.repository.UserJpaRepository;
import com.platform.scaffold.security.SecurityAuditLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.SliceImpl;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class UserServiceTest {

    private UserJpaRepository repository;
    private UserService service;

    @BeforeEach
    void setUp() {
        PersistenceGateway gateway = Mockito.mock(PersistenceGateway.class);
        when(gateway.inSession(anyString(), any())).thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
        repository = Mockito.mock(UserJpaRepository.class);
        service = new UserService(gateway, repository, new SecurityAuditLogger());
    }

    @Test
    void createStoresNewUser() {
        when(repository.existsByEmailOrUsername("a@example.com", "alice")).thenReturn(false);
        when(repository.save(any(UserEntity.class))).thenAnswer(inv -> {
            UserEntity entity = inv.getArgument(0);
            entity.setId(7L);
            return entity;
        });

        UserEntity created = service.create("a@example.com", "alice", "Alice", true);

        assertEquals(7L, created.getId());
        assertEquals("Alice", created.getFullName());
        assertTrue(created.isActive());
    }

    @Test
    void existingEmailOrUsernameIsDuplicate() {
        when(repository.existsByEmailOrUsername("a@example.com", "alice")).thenReturn(true);

        DuplicateResourceException ex = assertThrows(DuplicateResourceException.class,
            () -> service.create("a@example.com", "alice", null, true));

        assertEquals("User with this email or username already exists", ex.getMessage());
        verify(repository, never()).save(any());
    }

    @Test
    void constraintViolationIsDuplicate() {
        when(repository.existsByEmailOrUsername(anyString(), anyString())).thenReturn(false);
        when(repository.save(any(UserEntity.class))).thenThrow(new DataIntegrityViolationException("uq_users_email"));

        DuplicateResourceException ex = assertThrows(DuplicateResourceException.class,
            () -> service.create("a@example.com", "alice", null, true));

        assertInstanceOf(DataIntegrityViolationException.class, ex.getCause());
    }

    @Test
    void missingUserIsNotFound() {
        when(repository.findById(99999L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class, () -> service.getById(99999L));

        assertEquals("User 99999 not found", ex.getMessage());
    }

    @Test
    void listUsesOffsetPaging() {
        UserEntity third = UserEntity.builder().id(3L).email("c@example.com").username("carol").build();
        when(repository.findAllBy(any(Pageable.class))).thenReturn(new SliceImpl<>(List.of(third)));

        List<UserEntity> users = service.list(2, 1);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(repository).findAllBy(pageable.capture());
        assertEquals(2, pageable.getValue().getOffset());
        assertEquals(1, pageable.getValue().getPageSize());
        assertNotNull(pageable.getValue().getSort().getOrderFor("id"));
        assertEquals(List.of(third), users);
    }

    @Test
    void listRejectsOutOfRangeArguments() {
        assertThrows(ValidationException.class, () -> service.list(-1, 10));
        assertThrows(ValidationException.class, () -> service.list(0, 0));
        assertThrows(ValidationException.class, () -> service.list(0, UserService.MAX_LIMIT + 1));
        verifyNoInteractions(repository);
    }
}
