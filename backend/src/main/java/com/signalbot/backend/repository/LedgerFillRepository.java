package com.signalbot.backend.repository;

import com.signalbot.backend.model.LedgerFill;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LedgerFillRepository extends JpaRepository<LedgerFill, Long> {

    boolean existsByFillId(String fillId);

    List<LedgerFill> findByPairOrderByFilledAtAsc(String pair);
}
