package com.simscan.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    private Long id;

    private String username;

    private String email;

    @ToString.Exclude
    private String passwordHash;

    /** user / admin */
    private String role;

    private Integer credits;

    private LocalDateTime createdAt;

    public boolean isAdmin() {
        return UserRole.ADMIN.code().equals(role);
    }
}
