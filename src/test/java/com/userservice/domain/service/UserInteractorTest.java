package com.userservice.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.QueueMessage;
import com.userservice.domain.model.User;
import com.userservice.domain.port.CreateUserInput;
import com.userservice.domain.port.DeleteOutput;
import com.userservice.domain.port.DeleteUserInput;
import com.userservice.domain.port.GetUserInput;
import com.userservice.domain.port.ListUserInput;
import com.userservice.domain.port.ProcessMessageInput;
import com.userservice.domain.port.ProcessMessageOutput;
import com.userservice.domain.port.UpdateUserInput;
import com.userservice.domain.port.UserOutput;
import com.userservice.domain.repository.MessageQueueRepository;
import com.userservice.domain.repository.UserCacheRepository;
import com.userservice.domain.repository.UserRepository;
import com.userservice.domain.transaction.TransactionManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserInteractorTest {

    private static final Duration TTL = Duration.ofSeconds(3600);

    @Mock private TransactionManager txManager;
    @Mock private UserRepository userRepository;
    @Mock private UserCacheRepository userCache;
    @Mock private MessageQueueRepository messageQueue;

    private MeterRegistry meterRegistry;
    private ObjectMapper objectMapper;
    private UserInteractor userInteractor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new ObjectMapper().findAndRegisterModules();

        userInteractor = new UserInteractor(
                txManager,
                userRepository,
                userCache,
                messageQueue,
                objectMapper,
                meterRegistry,
                TTL
        );
    }

    @Test
    void create_persistsInTransaction_andWritesThrough() {
        runTransactionsInline();
        User saved = persistedUser("alice@example.com");
        when(userRepository.save(any(User.class))).thenReturn(saved);

        UserOutput result = userInteractor.create(new CreateUserInput("alice@example.com"));

        assertEquals(saved, result.getUser());
        assertNotNull(result.getUser().getId());
        assertNotNull(result.getUser().getCreatedAt());
        verify(txManager).doInTx(any());
        verify(userCache).store(saved, TTL);
    }

    @Test
    void create_invalidEmail_failsBeforeTouchingStore() {
        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.create(new CreateUserInput("not-an-email")));

        assertEquals(ErrorCode.VALIDATION_FAILED, e.getErrorCode());
        verifyNoInteractions(txManager, userRepository, userCache);
    }

    @Test
    void create_blankEmail_failsValidation() {
        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.create(new CreateUserInput("  ")));

        assertEquals(ErrorCode.VALIDATION_FAILED, e.getErrorCode());
    }

    @Test
    void create_cacheFailure_doesNotFailOperation() {
        runTransactionsInline();
        User saved = persistedUser("bob@example.com");
        when(userRepository.save(any(User.class))).thenReturn(saved);
        doThrow(new ServiceException(ErrorCode.CACHE_FAILED)).when(userCache).store(any(), any());

        UserOutput result = userInteractor.create(new CreateUserInput("bob@example.com"));

        assertEquals(saved, result.getUser());
        assertEquals(1.0, meterRegistry.counter("user.cache.failures", "operation", "store").count());
    }

    @Test
    void create_persistenceFailure_propagates_andSkipsCache() {
        when(txManager.doInTx(any())).thenThrow(new ServiceException(ErrorCode.PERSISTENCE_FAILED));

        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.create(new CreateUserInput("carol@example.com")));

        assertEquals(ErrorCode.PERSISTENCE_FAILED, e.getErrorCode());
        verifyNoInteractions(userCache);
    }

    @Test
    void get_cacheHit_skipsPrimaryStore() {
        User cached = persistedUser("dave@example.com");
        when(userCache.findById(cached.getId())).thenReturn(Optional.of(cached));

        UserOutput result = userInteractor.get(new GetUserInput(cached.getId()));

        assertEquals(cached, result.getUser());
        verify(userRepository, never()).findById(any());
        assertEquals(1.0, meterRegistry.counter("user.cache.lookups", "result", "hit").count());
    }

    @Test
    void get_cacheMiss_readsStore_andPopulatesCache() {
        User stored = persistedUser("erin@example.com");
        when(userCache.findById(stored.getId())).thenReturn(Optional.empty());
        when(userRepository.findById(stored.getId())).thenReturn(stored);

        UserOutput result = userInteractor.get(new GetUserInput(stored.getId()));

        assertEquals(stored, result.getUser());
        verify(userCache).store(stored, TTL);
    }

    @Test
    void get_cacheError_fallsBackToStore() {
        User stored = persistedUser("frank@example.com");
        when(userCache.findById(stored.getId())).thenThrow(new ServiceException(ErrorCode.CACHE_FAILED));
        when(userRepository.findById(stored.getId())).thenReturn(stored);

        UserOutput result = userInteractor.get(new GetUserInput(stored.getId()));

        assertEquals(stored, result.getUser());
        assertEquals(1.0, meterRegistry.counter("user.cache.failures", "operation", "find").count());
    }

    @Test
    void get_missingUser_notFound_andNothingCached() {
        UUID id = UUID.randomUUID();
        when(userCache.findById(id)).thenReturn(Optional.empty());
        when(userRepository.findById(id)).thenThrow(new ServiceException(ErrorCode.USER_NOT_FOUND));

        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.get(new GetUserInput(id)));

        assertEquals(ErrorCode.USER_NOT_FOUND, e.getErrorCode());
        verify(userCache, never()).store(any(), any());
    }

    @Test
    void createThenGet_isServedFromCache() {
        InMemoryUserCache cache = new InMemoryUserCache();
        UserInteractor interactor = new UserInteractor(
                txManager, userRepository, cache, messageQueue, objectMapper, meterRegistry, TTL);
        runTransactionsInline();
        User saved = persistedUser("grace@example.com");
        when(userRepository.save(any(User.class))).thenReturn(saved);

        User created = interactor.create(new CreateUserInput("grace@example.com")).getUser();
        User fetched = interactor.get(new GetUserInput(created.getId())).getUser();

        assertEquals("grace@example.com", fetched.getEmail());
        assertEquals(created.getId(), fetched.getId());
        verify(userRepository, never()).findById(any());
    }

    @Test
    void list_delegatesToStore() {
        List<User> users = List.of(persistedUser("a@example.com"), persistedUser("b@example.com"));
        when(userRepository.findAll(10, 0)).thenReturn(users);

        assertEquals(users, userInteractor.list(new ListUserInput(10, 0)).getUsers());
    }

    @Test
    void list_rejectsNonPositiveLimit() {
        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.list(new ListUserInput(0, 0)));

        assertEquals(ErrorCode.VALIDATION_FAILED, e.getErrorCode());
        verifyNoInteractions(userRepository);
    }

    @Test
    void update_overwritesCacheWithPersistedValue() {
        runTransactionsInline();
        User current = persistedUser("old@example.com");
        User updated = current.toBuilder()
                .email("new@example.com")
                .updatedAt(current.getUpdatedAt().plusSeconds(1))
                .build();
        when(userRepository.findById(current.getId())).thenReturn(current);
        when(userRepository.save(any(User.class))).thenReturn(updated);

        UserOutput result = userInteractor.update(new UpdateUserInput(current.getId(), "new@example.com"));

        assertEquals(updated, result.getUser());
        ArgumentCaptor<User> toSave = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(toSave.capture());
        assertEquals(current.getId(), toSave.getValue().getId());
        assertEquals("new@example.com", toSave.getValue().getEmail());
        verify(userCache).store(updated, TTL);
    }

    @Test
    void update_nonexistentUser_notFound_andNoCacheEntry() {
        UUID id = UUID.randomUUID();
        when(userRepository.findById(id)).thenThrow(new ServiceException(ErrorCode.USER_NOT_FOUND));

        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.update(new UpdateUserInput(id, "x@example.com")));

        assertEquals(ErrorCode.USER_NOT_FOUND, e.getErrorCode());
        verifyNoInteractions(userCache, txManager);
    }

    @Test
    void update_invalidEmail_failsValidation_withoutTransaction() {
        User current = persistedUser("ok@example.com");
        when(userRepository.findById(current.getId())).thenReturn(current);

        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.update(new UpdateUserInput(current.getId(), "broken")));

        assertEquals(ErrorCode.VALIDATION_FAILED, e.getErrorCode());
        verifyNoInteractions(txManager, userCache);
    }

    @Test
    void delete_removesCacheEntryAfterCommit() {
        runTransactionsInline();
        UUID id = UUID.randomUUID();
        when(userRepository.remove(id)).thenReturn(id);

        DeleteOutput result = userInteractor.delete(new DeleteUserInput(id));

        assertEquals(id, result.getId());
        InOrder inOrder = inOrder(userRepository, userCache);
        inOrder.verify(userRepository).remove(id);
        inOrder.verify(userCache).remove(id);
    }

    @Test
    void delete_cacheFailure_isLoggedOnly() {
        runTransactionsInline();
        UUID id = UUID.randomUUID();
        when(userRepository.remove(id)).thenReturn(id);
        doThrow(new ServiceException(ErrorCode.CACHE_FAILED)).when(userCache).remove(id);

        assertEquals(id, userInteractor.delete(new DeleteUserInput(id)).getId());
        assertEquals(1.0, meterRegistry.counter("user.cache.failures", "operation", "remove").count());
    }

    @Test
    void delete_storeFailure_leavesCacheUntouched() {
        when(txManager.doInTx(any())).thenThrow(new ServiceException(ErrorCode.PERSISTENCE_FAILED));

        assertThrows(ServiceException.class, () -> userInteractor.delete(new DeleteUserInput(UUID.randomUUID())));

        verifyNoInteractions(userCache);
    }

    @Test
    void deleteThenGet_notFound() {
        InMemoryUserCache cache = new InMemoryUserCache();
        UserInteractor interactor = new UserInteractor(
                txManager, userRepository, cache, messageQueue, objectMapper, meterRegistry, TTL);
        runTransactionsInline();
        User user = persistedUser("henry@example.com");
        cache.store(user, TTL);
        when(userRepository.remove(user.getId())).thenReturn(user.getId());
        when(userRepository.findById(user.getId())).thenThrow(new ServiceException(ErrorCode.USER_NOT_FOUND));

        interactor.delete(new DeleteUserInput(user.getId()));

        ServiceException e = assertThrows(ServiceException.class,
                () -> interactor.get(new GetUserInput(user.getId())));
        assertEquals(ErrorCode.USER_NOT_FOUND, e.getErrorCode());
        assertTrue(cache.entries.isEmpty());
    }

    @Test
    void processMessage_emptyQueue_returnsEmptyWithoutError() {
        when(messageQueue.receiveMessage(any())).thenReturn(List.of());

        Optional<ProcessMessageOutput> result = userInteractor.processMessage(new ProcessMessageInput(UUID.randomUUID()));

        assertTrue(result.isEmpty());
        verify(messageQueue).sendMessage(any(QueueMessage.class));
        verify(messageQueue, never()).deleteMessage(any());
    }

    @Test
    void processMessage_returnsSentId_andDeletesMessage() throws Exception {
        UUID id = UUID.randomUUID();
        String body = objectMapper.writeValueAsString(id);
        when(messageQueue.receiveMessage(any())).thenReturn(List.of(new QueueMessage(body, "receipt-1")));

        Optional<ProcessMessageOutput> result = userInteractor.processMessage(new ProcessMessageInput(id));

        assertTrue(result.isPresent());
        assertEquals(id, result.get().getId());
        ArgumentCaptor<QueueMessage> sent = ArgumentCaptor.forClass(QueueMessage.class);
        verify(messageQueue).sendMessage(sent.capture());
        assertEquals(body, sent.getValue().getBody());
        verify(messageQueue).deleteMessage("receipt-1");
    }

    @Test
    void processMessage_malformedBody_stillDeletesMessage() {
        when(messageQueue.receiveMessage(any())).thenReturn(List.of(new QueueMessage("not-json", "receipt-2")));

        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.processMessage(new ProcessMessageInput(UUID.randomUUID())));

        assertEquals(ErrorCode.MESSAGE_MALFORMED, e.getErrorCode());
        verify(messageQueue).deleteMessage("receipt-2");
        assertEquals(1.0, meterRegistry.counter("queue.messages.processed", "result", "malformed").count());
    }

    @Test
    void processMessage_nullBody_isMalformed_countedAndDeleted() {
        when(messageQueue.receiveMessage(any())).thenReturn(List.of(new QueueMessage("null", "receipt-4")));

        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.processMessage(new ProcessMessageInput(UUID.randomUUID())));

        assertEquals(ErrorCode.MESSAGE_MALFORMED, e.getErrorCode());
        verify(messageQueue).deleteMessage("receipt-4");
        assertEquals(1.0, meterRegistry.counter("queue.messages.processed", "result", "malformed").count());
        assertEquals(0.0, meterRegistry.counter("queue.messages.processed", "result", "success").count());
    }

    @Test
    void processMessage_deleteFailure_isLoggedOnly() throws Exception {
        UUID id = UUID.randomUUID();
        when(messageQueue.receiveMessage(any()))
                .thenReturn(List.of(new QueueMessage(objectMapper.writeValueAsString(id), "receipt-3")));
        doThrow(new ServiceException(ErrorCode.QUEUE_ACK_FAILED)).when(messageQueue).deleteMessage("receipt-3");

        Optional<ProcessMessageOutput> result = userInteractor.processMessage(new ProcessMessageInput(id));

        assertEquals(id, result.orElseThrow().getId());
        assertEquals(1.0, meterRegistry.counter("queue.ack.failures").count());
    }

    @Test
    void processMessage_sendFailure_propagates_withoutReceiving() {
        doThrow(new ServiceException(ErrorCode.QUEUE_UNAVAILABLE)).when(messageQueue).sendMessage(any());

        ServiceException e = assertThrows(ServiceException.class,
                () -> userInteractor.processMessage(new ProcessMessageInput(UUID.randomUUID())));

        assertEquals(ErrorCode.QUEUE_UNAVAILABLE, e.getErrorCode());
        verify(messageQueue, never()).receiveMessage(any());
    }

    private void runTransactionsInline() {
        when(txManager.doInTx(any())).thenAnswer(i -> i.<Supplier<Object>>getArgument(0).get());
    }

    private User persistedUser(String email) {
        Instant now = Instant.now();
        return User.builder()
                .id(UUID.randomUUID())
                .email(email)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static class InMemoryUserCache implements UserCacheRepository {

        private final Map<UUID, User> entries = new HashMap<>();

        @Override
        public void store(User user, Duration ttl) {
            entries.put(user.getId(), user);
        }

        @Override
        public Optional<User> findById(UUID id) {
            return Optional.ofNullable(entries.get(id));
        }

        @Override
        public void remove(UUID id) {
            entries.remove(id);
        }
    }
}
