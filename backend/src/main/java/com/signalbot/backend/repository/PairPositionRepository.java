package com.signalbot.backend.repository;

import com.signalbot.backend.model.PairPosition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PairPositionRepository extends JpaRepository<PairPosition, String> {
}
