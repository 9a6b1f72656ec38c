package com.simscan.mapper;

import com.simscan.user.domain.UserAccount;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface UserMapper {

    int insert(UserAccount user);

    UserAccount selectById(@Param("id") long id);

    UserAccount selectByEmail(@Param("email") String email);

    int countByEmailOrUsername(@Param("email") String email,
                               @Param("username") String username);

    int countByRole(@Param("role") String role);

    Integer selectCredits(@Param("id") long id);

    /**
     * {@code credits = credits - amount} only where {@code credits >= amount}.
     * Returns the number of rows changed (0 or 1).
     */
    int deductIfSufficient(@Param("id") long id,
                           @Param("amount") int amount);

    int addCredits(@Param("id") long id,
                   @Param("amount") int amount);

    int resetCreditsByRole(@Param("credits") int credits,
                           @Param("role") String role);
}
