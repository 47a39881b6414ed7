package com.userservice.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import com.userservice.domain.port.ListUserOutput;
import com.userservice.domain.port.ProcessMessageInput;
import com.userservice.domain.port.ProcessMessageOutput;
import com.userservice.domain.port.UpdateUserInput;
import com.userservice.domain.port.UserOutput;
import com.userservice.domain.repository.MessageQueueRepository;
import com.userservice.domain.repository.ReceiveMessageOptions;
import com.userservice.domain.repository.UserCacheRepository;
import com.userservice.domain.repository.UserRepository;
import com.userservice.domain.transaction.TransactionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Binds the primary store, the user cache and the message queue into one unit
 * of work per operation.
 *
 * Consistency rules:
 * - Writes commit to the primary store first; the cache is written (or cleared)
 *   only after the transaction succeeded.
 * - Reads are cache-aside. A cache miss or a cache failure falls back to the store.
 * - Cache failures never fail an operation. They are logged and counted.
 * - A received queue message is deleted on every exit path.
 *
 * No per-id locking happens here. Concurrent writes to the same user are ordered
 * by the store's transaction isolation, and the cache is last-write-wins per key.
 */
@Slf4j
@Service
public class UserInteractor {

    private final TransactionManager txManager;
    private final UserRepository userRepository;
    private final UserCacheRepository userCache;
    private final MessageQueueRepository messageQueue;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Duration cacheTtl;

    public UserInteractor(
            TransactionManager txManager,
            UserRepository userRepository,
            UserCacheRepository userCache,
            MessageQueueRepository messageQueue,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${app.cache.user-ttl:3600s}") Duration cacheTtl) {
        this.txManager = txManager;
        this.userRepository = userRepository;
        this.userCache = userCache;
        this.messageQueue = messageQueue;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.cacheTtl = cacheTtl;
    }

    public UserOutput create(CreateUserInput input) {
        User user = User.newUser(input.getEmail());
        user.validate();

        User created = txManager.doInTx(() -> userRepository.save(user));

        storeInCache(created);
        log.info("User created: {}", created.getId());
        return new UserOutput(created);
    }

    public UserOutput get(GetUserInput input) {
        Optional<User> cached = findInCache(input.getId());
        if (cached.isPresent()) {
            return new UserOutput(cached.get());
        }

        User user = userRepository.findById(input.getId());
        storeInCache(user);
        return new UserOutput(user);
    }

    public ListUserOutput list(ListUserInput input) {
        if (input.getLimit() <= 0 || input.getOffset() < 0) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED,
                    "limit must be positive and offset non-negative");
        }
        List<User> users = userRepository.findAll(input.getLimit(), input.getOffset());
        return new ListUserOutput(users);
    }

    public UserOutput update(UpdateUserInput input) {
        User current = userRepository.findById(input.getId());

        User user = User.withId(current.getId(), input.getEmail());
        user.validate();

        User updated = txManager.doInTx(() -> userRepository.save(user));

        storeInCache(updated);
        log.info("User updated: {}", updated.getId());
        return new UserOutput(updated);
    }

    public DeleteOutput delete(DeleteUserInput input) {
        UUID deletedId = txManager.doInTx(() -> userRepository.remove(input.getId()));

        try {
            userCache.remove(input.getId());
        } catch (ServiceException e) {
            // an orphaned entry expires with its TTL
            log.warn("Failed to delete cache for user {}: {}", input.getId(), e.getMessage());
            countCacheFailure("remove");
        }

        log.info("User deleted: {}", deletedId);
        return new DeleteOutput(deletedId);
    }

    /**
     * Sends the id to the queue, then receives at most one message and decodes it.
     *
     * Returns empty when nothing was visible yet; delivery is asynchronous, so that
     * is not an error. A received message is deleted whether decoding succeeds or not.
     *
     * @throws ServiceException {@code QUEUE_UNAVAILABLE} if send or receive fails,
     *         {@code MESSAGE_MALFORMED} if the received body is not a JSON id
     */
    public Optional<ProcessMessageOutput> processMessage(ProcessMessageInput input) {
        String body;
        try {
            body = objectMapper.writeValueAsString(input.getId());
        } catch (JsonProcessingException e) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED, "id is not serializable", e);
        }

        messageQueue.sendMessage(QueueMessage.of(body));

        List<QueueMessage> messages = messageQueue.receiveMessage(
                ReceiveMessageOptions.builder().maxNumberOfMessages(1).build());
        if (messages.isEmpty()) {
            countProcessed("empty");
            return Optional.empty();
        }

        QueueMessage message = messages.get(0);
        try {
            UUID userId = decode(message);
            log.info("Dequeued user_id: {}", userId);
            countProcessed("success");
            return Optional.of(new ProcessMessageOutput(userId));
        } finally {
            acknowledge(message);
        }
    }

    private UUID decode(QueueMessage message) {
        UUID userId;
        try {
            userId = message.getBody() == null ? null : objectMapper.readValue(message.getBody(), UUID.class);
        } catch (JsonProcessingException e) {
            countProcessed("malformed");
            throw new ServiceException(ErrorCode.MESSAGE_MALFORMED,
                    "Cannot decode message body: " + message.getBody(), e);
        }
        if (userId == null) {
            countProcessed("malformed");
            throw new ServiceException(ErrorCode.MESSAGE_MALFORMED, "message body is null");
        }
        return userId;
    }

    private void acknowledge(QueueMessage message) {
        try {
            messageQueue.deleteMessage(message.getReceiptHandle());
        } catch (ServiceException e) {
            log.warn("Failed to delete message {}: {}", message.getReceiptHandle(), e.getMessage());
            Counter.builder("queue.ack.failures")
                    .register(meterRegistry)
                    .increment();
        }
    }

    private Optional<User> findInCache(UUID id) {
        try {
            Optional<User> cached = userCache.findById(id);
            Counter.builder("user.cache.lookups")
                    .tag("result", cached.isPresent() ? "hit" : "miss")
                    .register(meterRegistry)
                    .increment();
            if (cached.isPresent()) {
                log.debug("Cache hit for user {}", id);
            }
            return cached;
        } catch (ServiceException e) {
            log.warn("Failed to read cache for user {}: {}", id, e.getMessage());
            countCacheFailure("find");
            return Optional.empty();
        }
    }

    private void storeInCache(User user) {
        try {
            userCache.store(user, cacheTtl);
        } catch (ServiceException e) {
            log.warn("Failed to set cache for user {}: {}", user.getId(), e.getMessage());
            countCacheFailure("store");
        }
    }

    private void countCacheFailure(String operation) {
        Counter.builder("user.cache.failures")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    private void countProcessed(String result) {
        Counter.builder("queue.messages.processed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
