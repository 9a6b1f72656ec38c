package com.simscan.credit.impl;

import com.simscan.credit.CreditRequestQueue;
import com.simscan.credit.domain.CreditRequest;
import com.simscan.credit.domain.CreditRequestStatus;
import com.simscan.error.ForbiddenException;
import com.simscan.error.InvalidStateException;
import com.simscan.error.NotFoundException;
import com.simscan.error.ValidationException;
import com.simscan.ledger.CreditLedger;
import com.simscan.mapper.CreditRequestMapper;
import com.simscan.user.domain.UserAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseCreditRequestQueue implements CreditRequestQueue {

    private final CreditRequestMapper mapper;
    private final CreditLedger ledger;
    private final Clock clock;

    @Override
    public CreditRequest submit(long userId, int amount) {
        if (amount < 1) {
            throw new ValidationException("Invalid credit request amount!");
        }
        CreditRequest request = CreditRequest.builder()
                .userId(userId)
                .amount(amount)
                .status(CreditRequestStatus.PENDING.code())
                .requestedAt(LocalDateTime.now(clock))
                .build();
        mapper.insert(request);
        log.info("[CREDIT] request id={} user={} amount={} submitted", request.getId(), userId, amount);
        return request;
    }

    /**
     * The status flip is conditional on {@code pending} and shares the transaction with the grant:
     * a lost race sees zero rows, a failed grant rolls the flip back.
     */
    @Transactional
    @Override
    public CreditRequest approve(long requestId, UserAccount actor) {
        CreditRequest request = claim(requestId, actor, CreditRequestStatus.APPROVED);
        ledger.grant(request.getUserId(), request.getAmount());
        log.info("[CREDIT] request id={} approved by admin={} user={} amount={}",
                requestId, actor.getId(), request.getUserId(), request.getAmount());
        return mapper.selectById(requestId);
    }

    @Transactional
    @Override
    public CreditRequest reject(long requestId, UserAccount actor) {
        CreditRequest request = claim(requestId, actor, CreditRequestStatus.REJECTED);
        log.info("[CREDIT] request id={} rejected by admin={} user={}",
                requestId, actor.getId(), request.getUserId());
        return mapper.selectById(requestId);
    }

    @Override
    public List<CreditRequest> listPending() {
        return mapper.selectPendingWithUsername();
    }

    @Override
    public List<CreditRequest> listByUser(long userId) {
        return mapper.selectByUser(userId);
    }

    private CreditRequest claim(long requestId, UserAccount actor, CreditRequestStatus target) {
        if (actor == null || !actor.isAdmin()) {
            throw new ForbiddenException("Access Denied! Admin only.");
        }
        CreditRequest request = mapper.selectById(requestId);
        if (request == null) {
            throw new NotFoundException("Credit request not found.");
        }
        if (!request.isPending()) {
            throw new InvalidStateException("Credit request " + requestId + " is already " + request.getStatus());
        }
        int rows = mapper.transition(requestId, CreditRequestStatus.PENDING.code(), target.code(), actor.getId());
        if (rows == 0) {
            throw new InvalidStateException("Credit request " + requestId + " was decided concurrently");
        }
        return request;
    }
}
