package com.userservice.domain.service;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.Match;
import com.userservice.domain.port.CreateMatchInput;
import com.userservice.domain.port.DeleteMatchInput;
import com.userservice.domain.port.DeleteOutput;
import com.userservice.domain.port.GetMatchInput;
import com.userservice.domain.port.ListMatchInput;
import com.userservice.domain.port.UpdateMatchInput;
import com.userservice.domain.repository.MatchRepository;
import com.userservice.domain.transaction.TransactionHandle;
import com.userservice.domain.transaction.TransactionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Match operations. Nothing here is cached, so writes use explicit
 * transaction handles instead of {@link TransactionManager#doInTx}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchInteractor {

    private final TransactionManager txManager;
    private final MatchRepository matchRepository;
    private final MatchingDomainService matchingService;

    public Match create(CreateMatchInput input) {
        Match match = matchingService.createMatch(input.getMeId(), input.getPartnerId());

        try (TransactionHandle tx = txManager.begin()) {
            Match created = matchRepository.createTx(tx, match);
            tx.commit();
            log.info("Match created: {} ({} -> {})", created.getId(), created.getMeId(), created.getPartnerId());
            return created;
        }
    }

    public Match get(GetMatchInput input) {
        return matchRepository.get(input.getId());
    }

    public List<Match> list(ListMatchInput input) {
        if (input.getLimit() <= 0 || input.getOffset() < 0) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED,
                    "limit must be positive and offset non-negative");
        }
        return matchRepository.list(input.getUserId(), input.getLimit(), input.getOffset());
    }

    public Match update(UpdateMatchInput input) {
        Match current = matchRepository.get(input.getId());
        Match changed = matchingService.changeStatus(current, input.getStatus());

        try (TransactionHandle tx = txManager.begin()) {
            Match updated = matchRepository.updateTx(tx, changed);
            tx.commit();
            return updated;
        }
    }

    public DeleteOutput delete(DeleteMatchInput input) {
        try (TransactionHandle tx = txManager.begin()) {
            UUID deletedId = matchRepository.deleteTx(tx, input.getId());
            tx.commit();
            return new DeleteOutput(deletedId);
        }
    }
}
