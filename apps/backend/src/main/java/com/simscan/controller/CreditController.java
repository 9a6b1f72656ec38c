package com.simscan.controller;

import com.simscan.api.dto.CreditRequestBody;
import com.simscan.credit.CreditRequestQueue;
import com.simscan.error.ValidationException;
import com.simscan.user.CallerResolver;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping("/credits")
@RequiredArgsConstructor
public class CreditController {

    private final CreditRequestQueue queue;
    private final CallerResolver callerResolver;

    @Operation(summary = "Ask an admin for more credits")
    @PostMapping(value = "/request", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> request(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId,
                                             @RequestBody CreditRequestBody body) {
        return Mono.fromCallable(() -> {
            var caller = callerResolver.requireUser(userId);
            if (body.amount() == null) {
                throw new ValidationException("Invalid credit request amount!");
            }
            var saved = queue.submit(caller.getId(), body.amount());
            return Map.<String, Object>of(
                    "message", "Credit request submitted for admin approval.",
                    "requestId", saved.getId()
            );
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
