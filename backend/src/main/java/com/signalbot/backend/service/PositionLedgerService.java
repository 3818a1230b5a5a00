package com.signalbot.backend.service;

import com.signalbot.backend.dto.FillIngestion;
import com.signalbot.backend.dto.LedgerFillRequest;
import com.signalbot.backend.dto.PositionSummary;
import com.signalbot.backend.model.LedgerFill;
import com.signalbot.backend.model.PairPosition;
import com.signalbot.backend.model.PositionLot;
import com.signalbot.backend.model.TradeSide;
import com.signalbot.backend.repository.LedgerFillRepository;
import com.signalbot.backend.repository.PairPositionRepository;
import com.signalbot.backend.repository.PositionLotRepository;
import com.signalbot.backend.trading.pipeline.MarketDataProvider;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * FIFO cost-basis ledger, one lot queue per pair.
 * <p>
 * Buy fees are folded into the lot's unit cost; sell fees reduce realized P&amp;L.
 * Fills are keyed by fill id and applied at most once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionLedgerService {

    private final PositionLotRepository positionLotRepository;
    private final LedgerFillRepository ledgerFillRepository;
    private final PairPositionRepository pairPositionRepository;
    private final MarketDataProvider marketDataProvider;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> pairLocks = new ConcurrentHashMap<>();

    public FillIngestion ingestFill(LedgerFillRequest fill) {
        validate(fill);
        return withPairLock(fill.pair(), () -> transactionTemplate.execute(status -> apply(fill)));
    }

    /**
     * Runs {@code work} holding the pair's ledger lock. A caller that ingests a fill inside its own
     * transaction must open and commit that transaction within {@code work}, otherwise a second
     * writer on the pair reads lots and totals that are not committed yet.
     */
    public <T> T withPairLock(String pair, Supplier<T> work) {
        ReentrantLock lock = pairLocks.computeIfAbsent(pair, key -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public PositionSummary getPositionSummary(String pair) {
        return getPositionSummary(pair, marketDataProvider.getPrice(pair).orElse(null));
    }

    /**
     * Summary valued at {@code currentPrice}; unrealized P&amp;L is zero when no price is given.
     */
    public PositionSummary getPositionSummary(String pair, BigDecimal currentPrice) {
        List<PositionLot> lots = positionLotRepository.findByPairOrderByIdAsc(pair);
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (PositionLot lot : lots) {
            quantity = quantity.add(lot.getQuantity());
            cost = cost.add(lot.getQuantity().multiply(lot.getUnitCost()));
        }
        BigDecimal averageCost = quantity.signum() > 0
                ? cost.divide(quantity, MoneyUtils.QUANTITY_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        if (currentPrice != null && quantity.signum() > 0) {
            unrealized = quantity.multiply(currentPrice.subtract(averageCost));
        }
        PairPosition position = pairPositionRepository.findById(pair).orElse(null);
        BigDecimal realized = position == null ? BigDecimal.ZERO : position.getRealizedPnl();
        BigDecimal fees = position == null ? BigDecimal.ZERO : position.getTotalFees();
        return new PositionSummary(
                pair,
                MoneyUtils.quantity(quantity),
                MoneyUtils.pnl(averageCost),
                MoneyUtils.pnl(realized),
                MoneyUtils.pnl(unrealized),
                MoneyUtils.pnl(fees),
                lots.size()
        );
    }

    private FillIngestion apply(LedgerFillRequest fill) {
        if (ledgerFillRepository.existsByFillId(fill.fillId())) {
            log.debug("Duplicate fill ignored fillId={} pair={}", fill.fillId(), fill.pair());
            return FillIngestion.duplicate();
        }
        Instant now = Instant.now(clock);
        PairPosition position = pairPositionRepository.findById(fill.pair())
                .orElseGet(() -> PairPosition.builder().pair(fill.pair()).build());
        BigDecimal fee = MoneyUtils.orZero(fill.fee());
        BigDecimal realized = null;
        BigDecimal unmatched = BigDecimal.ZERO;

        if (fill.side() == TradeSide.BUY) {
            BigDecimal unitCost = fill.price()
                    .add(fee.divide(fill.quantity(), MoneyUtils.QUANTITY_SCALE, RoundingMode.HALF_UP));
            positionLotRepository.save(PositionLot.builder()
                    .pair(fill.pair())
                    .quantity(fill.quantity())
                    .unitCost(unitCost)
                    .fillId(fill.fillId())
                    .purchaseDate(fill.filledAt() == null ? now : fill.filledAt())
                    .build());
            position.setBuyCount(position.getBuyCount() + 1);
        } else {
            BigDecimal remaining = fill.quantity();
            BigDecimal gross = BigDecimal.ZERO;
            for (PositionLot lot : positionLotRepository.findByPairOrderByIdAsc(fill.pair())) {
                if (remaining.signum() <= 0) {
                    break;
                }
                BigDecimal consumed = MoneyUtils.min(lot.getQuantity(), remaining);
                gross = gross.add(consumed.multiply(fill.price().subtract(lot.getUnitCost())));
                remaining = remaining.subtract(consumed);
                if (consumed.compareTo(lot.getQuantity()) == 0) {
                    positionLotRepository.delete(lot);
                } else {
                    lot.setQuantity(lot.getQuantity().subtract(consumed));
                    positionLotRepository.save(lot);
                }
            }
            if (remaining.signum() > 0) {
                unmatched = remaining;
                log.warn("Sell fill exceeds open lots fillId={} pair={} unmatched={}", fill.fillId(), fill.pair(), remaining);
            }
            realized = MoneyUtils.pnl(gross.subtract(fee));
            position.setRealizedPnl(position.getRealizedPnl().add(realized));
            position.setSellCount(position.getSellCount() + 1);
        }

        position.setTotalFees(position.getTotalFees().add(fee));
        position.setUpdatedAt(now);
        pairPositionRepository.save(position);
        ledgerFillRepository.save(LedgerFill.builder()
                .fillId(fill.fillId())
                .pair(fill.pair())
                .side(fill.side())
                .quantity(fill.quantity())
                .price(fill.price())
                .fee(fee)
                .realizedPnl(realized)
                .filledAt(fill.filledAt() == null ? now : fill.filledAt())
                .build());
        log.info("Fill applied fillId={} pair={} side={} qty={} price={} realizedPnl={}",
                fill.fillId(), fill.pair(), fill.side(), fill.quantity(), fill.price(), realized);
        return new FillIngestion(true, realized, unmatched);
    }

    private void validate(LedgerFillRequest fill) {
        if (fill.fillId() == null || fill.fillId().isBlank()) {
            throw new IllegalArgumentException("Fill id is required");
        }
        if (fill.pair() == null || fill.side() == null) {
            throw new IllegalArgumentException("Fill pair and side are required");
        }
        if (fill.quantity() == null || fill.quantity().signum() <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + fill.quantity());
        }
        if (fill.price() == null || fill.price().signum() <= 0) {
            throw new IllegalArgumentException("Fill price must be positive: " + fill.price());
        }
    }
}
