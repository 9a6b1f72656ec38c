package com.simscan.credit;

import com.simscan.credit.domain.CreditRequest;
import com.simscan.user.domain.UserAccount;

import java.util.List;

/**
 * Pending credit grant requests awaiting an admin decision.
 */
public interface CreditRequestQueue {

    /** @throws com.simscan.error.ValidationException amount below 1 */
    CreditRequest submit(long userId, int amount);

    /**
     * Grants the requested amount and marks the request approved, as one unit.
     *
     * @throws com.simscan.error.ForbiddenException    actor is not an admin
     * @throws com.simscan.error.NotFoundException     unknown request
     * @throws com.simscan.error.InvalidStateException request already decided
     */
    CreditRequest approve(long requestId, UserAccount actor);

    /** Same preconditions as {@link #approve}; the ledger is not touched. */
    CreditRequest reject(long requestId, UserAccount actor);

    List<CreditRequest> listPending();

    List<CreditRequest> listByUser(long userId);
}
