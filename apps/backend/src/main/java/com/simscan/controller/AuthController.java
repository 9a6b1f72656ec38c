package com.simscan.controller;

import com.simscan.api.dto.LoginRequest;
import com.simscan.api.dto.RegisterRequest;
import com.simscan.api.dto.UserProfile;
import com.simscan.user.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AccountService accountService;

    @Operation(summary = "Register a user account")
    @PostMapping(value = "/register", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Map<String, Object>> register(@Valid @RequestBody RegisterRequest req) {
        return Mono.fromCallable(() -> accountService.register(req.username(), req.email(), req.password()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(user -> Map.<String, Object>of(
                        "message", "User registered successfully!",
                        "user", UserProfile.from(user)
                ));
    }

    /**
     * Verifies the credentials and returns the profile; the id is what callers send as {@code X-User-Id}.
     */
    @Operation(summary = "Check credentials and return the account profile")
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> login(@Valid @RequestBody LoginRequest req) {
        return Mono.fromCallable(() -> accountService.login(req.email(), req.password()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(user -> Map.<String, Object>of(
                        "message", "Login successful!",
                        "user", UserProfile.from(user)
                ));
    }
}
