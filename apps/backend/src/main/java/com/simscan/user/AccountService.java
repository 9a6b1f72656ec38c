package com.simscan.user;

import com.simscan.config.CreditProperties;
import com.simscan.error.NotFoundException;
import com.simscan.error.UnauthorizedException;
import com.simscan.error.ValidationException;
import com.simscan.mapper.UserMapper;
import com.simscan.user.domain.UserAccount;
import com.simscan.user.domain.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final UserMapper userMapper;
    private final PasswordEncoder passwordEncoder;
    private final CreditProperties creditProps;
    private final Clock clock;

    public UserAccount register(String username, String email, String password) {
        if (!StringUtils.hasText(username) || !StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            throw new ValidationException("All fields are required!");
        }
        if (userMapper.countByEmailOrUsername(email, username) > 0) {
            throw new ValidationException("Email or Username already exists!");
        }
        UserAccount user = newAccount(username, email, password, UserRole.USER, creditProps.getDefaultBalance());
        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException e) {
            throw new ValidationException("Email or Username already exists!");
        }
        log.info("Registered user id={} username={}", user.getId(), username);
        return user;
    }

    public UserAccount createAdmin(String username, String email, String password) {
        UserAccount admin = newAccount(username, email, password, UserRole.ADMIN, creditProps.getAdminBalance());
        userMapper.insert(admin);
        return admin;
    }

    public boolean adminExists() {
        return userMapper.countByRole(UserRole.ADMIN.code()) > 0;
    }

    public UserAccount login(String email, String password) {
        if (!StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            throw new ValidationException("Email and password are required!");
        }
        UserAccount user = userMapper.selectByEmail(email);
        if (user == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            log.info("Rejected login for email={}", email);
            throw new UnauthorizedException("Invalid credentials!");
        }
        return user;
    }

    public UserAccount profile(long userId) {
        UserAccount user = userMapper.selectById(userId);
        if (user == null) {
            throw new NotFoundException("User not found: " + userId);
        }
        return user;
    }

    private UserAccount newAccount(String username, String email, String password, UserRole role, int credits) {
        return UserAccount.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordEncoder.encode(password))
                .role(role.code())
                .credits(credits)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }
}
