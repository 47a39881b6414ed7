package com.userservice.infrastructure.persistence.repository;

import com.userservice.infrastructure.persistence.entity.MatchEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface MatchJpaRepository extends JpaRepository<MatchEntity, UUID> {
}
