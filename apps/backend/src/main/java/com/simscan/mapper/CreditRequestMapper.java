package com.simscan.mapper;

import com.simscan.credit.domain.CreditRequest;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface CreditRequestMapper {

    int insert(CreditRequest request);

    CreditRequest selectById(@Param("id") long id);

    /**
     * Moves a request from {@code fromStatus} to {@code toStatus}; 0 rows when it was no longer in {@code fromStatus}.
     */
    int transition(@Param("id") long id,
                   @Param("fromStatus") String fromStatus,
                   @Param("toStatus") String toStatus,
                   @Param("decidedBy") long decidedBy);

    /** Pending requests joined with the requesting username, oldest first. */
    List<CreditRequest> selectPendingWithUsername();

    List<CreditRequest> selectByUser(@Param("userId") long userId);
}
