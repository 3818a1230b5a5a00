package com.signalbot.backend.repository;

import com.signalbot.backend.model.PositionLot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PositionLotRepository extends JpaRepository<PositionLot, Long> {

    // FIFO order: oldest lot first
    List<PositionLot> findByPairOrderByIdAsc(String pair);
}
