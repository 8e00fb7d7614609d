package com.goldtrader.service;

import com.goldtrader.domain.enums.TransactionStatus;
import com.goldtrader.domain.model.Transaction;
import com.goldtrader.entity.TransactionEntity;
import com.goldtrader.exception.InvalidStateException;
import com.goldtrader.exception.ResourceNotFoundException;
import com.goldtrader.mapper.TransactionMapper;
import com.goldtrader.repository.jpa.TransactionJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Durable record of every transaction and its lifecycle status.
 *
 * <p>Writers are the OrderService (creation, cancellation) and the ExecutionWorker (settlement
 * outcome). A terminal transaction never goes back to pending or processing. Between the two
 * terminal states the last write wins, so a settlement finishing after a cancel overwrites it.
 */
@Service
public class TransactionStore {

    private static final Logger log = LoggerFactory.getLogger(TransactionStore.class);

    private final TransactionJpaRepository transactionJpaRepository;
    private final TransactionMapper transactionMapper;

    public TransactionStore(TransactionJpaRepository transactionJpaRepository, TransactionMapper transactionMapper) {
        this.transactionJpaRepository = transactionJpaRepository;
        this.transactionMapper = transactionMapper;
    }

    /** Persists a new transaction, assigning its id and timestamps. */
    public Transaction create(Transaction transaction) {
        LocalDateTime now = LocalDateTime.now();
        Transaction toSave = transaction.toBuilder()
                .id(transaction.getId() != null ? transaction.getId() : UUID.randomUUID().toString())
                .executedQuantity(
                        transaction.getExecutedQuantity() != null ? transaction.getExecutedQuantity() : BigDecimal.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Transaction saved = save(toSave);
        log.debug("Transaction created: id={}, userId={}, status={}", saved.getId(), saved.getUserId(), saved.getStatus());
        return saved;
    }

    public Optional<Transaction> findById(String id) {
        return transactionJpaRepository.findById(id).map(transactionMapper::toDomain);
    }

    /**
     * Moves the transaction to {@code status}.
     *
     * @throws ResourceNotFoundException if no such transaction exists
     * @throws InvalidStateException if a terminal transaction would move back to a non-terminal status
     */
    public Transaction updateStatus(String id, TransactionStatus status, String errorMessage) {
        Transaction current = require(id);
        if (current.getStatus().isTerminal() && !status.isTerminal()) {
            throw new InvalidStateException(
                    "Transaction " + id + " is " + current.getStatus() + " and cannot move to " + status);
        }
        Transaction updated = current.toBuilder()
                .status(status)
                .errorMessage(errorMessage)
                .updatedAt(LocalDateTime.now())
                .build();
        return save(updated);
    }

    /** Records a successful settlement. */
    public Transaction complete(
            String id, BigDecimal executedQuantity, BigDecimal executedPricePerUnit, BigDecimal executedAmount) {
        Transaction updated = require(id).toBuilder()
                .status(TransactionStatus.COMPLETED)
                .executedQuantity(executedQuantity)
                .executedPricePerUnit(executedPricePerUnit)
                .executedAmount(executedAmount)
                .errorMessage(null)
                .updatedAt(LocalDateTime.now())
                .build();
        return save(updated);
    }

    public Transaction attachPollUrl(String id, String pollUrl) {
        Transaction updated = require(id).toBuilder()
                .pollUrl(pollUrl)
                .updatedAt(LocalDateTime.now())
                .build();
        return save(updated);
    }

    /** History newest first, paged by offset. */
    public List<Transaction> findByUser(String userId, int limit, int offset) {
        return transactionJpaRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .skip(offset)
                .limit(limit)
                .map(transactionMapper::toDomain)
                .collect(Collectors.toList());
    }

    public List<Transaction> findByUserAndStatus(String userId, TransactionStatus status) {
        return transactionMapper.toDomainList(transactionJpaRepository.findByUserIdAndStatus(userId, status));
    }

    private Transaction require(String id) {
        return findById(id).orElseThrow(() -> new ResourceNotFoundException("Transaction", id));
    }

    private Transaction save(Transaction transaction) {
        TransactionEntity saved = transactionJpaRepository.save(transactionMapper.toEntity(transaction));
        return transactionMapper.toDomain(saved);
    }
}
