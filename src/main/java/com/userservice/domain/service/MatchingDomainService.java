package com.userservice.domain.service;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.Match;
import com.userservice.domain.model.MatchStatus;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Rules for creating matches and moving them between states.
 */
@Service
public class MatchingDomainService {

    public Match createMatch(UUID meId, UUID partnerId) {
        if (meId == null || partnerId == null) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED, "both participants are required");
        }
        if (meId.equals(partnerId)) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED, "a user cannot match with themselves");
        }
        return Match.builder()
                .meId(meId)
                .partnerId(partnerId)
                .status(MatchStatus.PENDING)
                .build();
    }

    /**
     * Only a pending match can be answered; answering with the same status is a no-op.
     */
    public Match changeStatus(Match match, MatchStatus status) {
        if (status == null) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED, "status is required");
        }
        if (match.getStatus() == status) {
            return match;
        }
        if (match.getStatus() != MatchStatus.PENDING) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED,
                    "match " + match.getId() + " is already " + match.getStatus());
        }
        return match.toBuilder().status(status).build();
    }
}
