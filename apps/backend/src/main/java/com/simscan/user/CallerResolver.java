package com.simscan.user;

import com.simscan.error.ForbiddenException;
import com.simscan.error.UnauthorizedException;
import com.simscan.mapper.UserMapper;
import com.simscan.user.domain.UserAccount;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns the identity header supplied by the request layer into an account.
 */
@Component
@RequiredArgsConstructor
public class CallerResolver {

    public static final String USER_HEADER = "X-User-Id";

    private final UserMapper userMapper;

    public UserAccount requireUser(String rawUserId) {
        if (rawUserId == null || rawUserId.isBlank()) {
            throw new UnauthorizedException("Not Authorized! Please Login");
        }
        long id;
        try {
            id = Long.parseLong(rawUserId.trim());
        } catch (NumberFormatException e) {
            throw new UnauthorizedException("Not Authorized! Please Login");
        }
        UserAccount user = userMapper.selectById(id);
        if (user == null) {
            throw new UnauthorizedException("Not Authorized! Please Login");
        }
        return user;
    }

    public UserAccount requireAdmin(String rawUserId) {
        UserAccount user = requireUser(rawUserId);
        if (!user.isAdmin()) {
            throw new ForbiddenException("Access Denied! Admin only.");
        }
        return user;
    }
}
