package com.simscan.api.dto;

import com.simscan.user.domain.UserAccount;

/** Account view without the password hash. */
public record UserProfile(long id, String username, String email, String role, int credits) {

    public static UserProfile from(UserAccount u) {
        return new UserProfile(u.getId(), u.getUsername(), u.getEmail(), u.getRole(), u.getCredits());
    }
}
