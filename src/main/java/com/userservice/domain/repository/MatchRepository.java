package com.userservice.domain.repository;

import com.userservice.domain.model.Match;
import com.userservice.domain.transaction.TransactionHandle;

import java.util.List;
import java.util.UUID;

/**
 * Match store with explicit transaction variants.
 *
 * The {@code *Tx} methods require an active handle obtained from
 * {@link com.userservice.domain.transaction.TransactionManager#begin()}.
 */
public interface MatchRepository {

    Match createTx(TransactionHandle tx, Match match);

    Match updateTx(TransactionHandle tx, Match match);

    UUID deleteTx(TransactionHandle tx, UUID id);

    Match get(UUID id);

    List<Match> list(UUID userId, int limit, int offset);
}
