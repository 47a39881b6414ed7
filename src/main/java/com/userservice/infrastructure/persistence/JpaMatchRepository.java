package com.userservice.infrastructure.persistence;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.Match;
import com.userservice.domain.repository.MatchRepository;
import com.userservice.domain.transaction.TransactionHandle;
import com.userservice.infrastructure.persistence.entity.MatchEntity;
import com.userservice.infrastructure.persistence.repository.MatchJpaRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

@Repository
@RequiredArgsConstructor
public class JpaMatchRepository implements MatchRepository {

    private final MatchJpaRepository jpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Match createTx(TransactionHandle tx, Match match) {
        requireActive(tx);
        MatchEntity entity = MatchEntity.builder()
                .meId(match.getMeId())
                .partnerId(match.getPartnerId())
                .status(match.getStatus())
                .build();
        return translated(() -> toDomain(jpaRepository.save(entity)));
    }

    @Override
    public Match updateTx(TransactionHandle tx, Match match) {
        requireActive(tx);
        return translated(() -> {
            MatchEntity entity = jpaRepository.findById(match.getId())
                    .orElseThrow(() -> notFound(match.getId()));
            entity.setStatus(match.getStatus());
            // flush so @PreUpdate stamps updatedAt before it is returned
            jpaRepository.flush();
            return toDomain(entity);
        });
    }

    @Override
    public UUID deleteTx(TransactionHandle tx, UUID id) {
        requireActive(tx);
        return translated(() -> {
            MatchEntity entity = jpaRepository.findById(id)
                    .orElseThrow(() -> notFound(id));
            jpaRepository.delete(entity);
            return entity.getId();
        });
    }

    @Override
    public Match get(UUID id) {
        return translated(() -> jpaRepository.findById(id)
                .map(JpaMatchRepository::toDomain)
                .orElseThrow(() -> notFound(id)));
    }

    @Override
    public List<Match> list(UUID userId, int limit, int offset) {
        return translated(() -> entityManager
                .createQuery("select m from MatchEntity m where m.meId = :userId or m.partnerId = :userId "
                        + "order by m.createdAt desc, m.id", MatchEntity.class)
                .setParameter("userId", userId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList()
                .stream()
                .map(JpaMatchRepository::toDomain)
                .toList());
    }

    private static <T> T translated(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | PersistenceException e) {
            throw new ServiceException(ErrorCode.PERSISTENCE_FAILED, "Match store operation failed", e);
        }
    }

    private static void requireActive(TransactionHandle tx) {
        if (tx == null || tx.isCompleted()) {
            throw new IllegalStateException("An open transaction handle is required");
        }
    }

    private static Match toDomain(MatchEntity entity) {
        return Match.builder()
                .id(entity.getId())
                .meId(entity.getMeId())
                .partnerId(entity.getPartnerId())
                .status(entity.getStatus())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private static ServiceException notFound(UUID id) {
        return new ServiceException(ErrorCode.MATCH_NOT_FOUND, "Match not found: " + id);
    }
}
