package com.simscan.controller;

import com.simscan.api.dto.DocumentView;
import com.simscan.api.dto.UserProfile;
import com.simscan.credit.CreditRequestQueue;
import com.simscan.credit.domain.CreditRequest;
import com.simscan.document.service.DocumentService;
import com.simscan.user.AccountService;
import com.simscan.user.CallerResolver;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/user")
@RequiredArgsConstructor
public class UserController {

    private final CallerResolver callerResolver;
    private final AccountService accountService;
    private final DocumentService documentService;
    private final CreditRequestQueue creditRequestQueue;

    @Operation(summary = "Current account with its live credit balance")
    @GetMapping("/profile")
    public Mono<UserProfile> profile(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> UserProfile.from(
                        accountService.profile(callerResolver.requireUser(userId).getId())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Documents submitted by the caller")
    @GetMapping("/documents")
    public Mono<List<DocumentView>> documents(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> documentService.listUserDocuments(callerResolver.requireUser(userId).getId())
                        .stream().map(DocumentView::from).toList())
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Credit requests submitted by the caller")
    @GetMapping("/credit-requests")
    public Mono<List<CreditRequest>> creditRequests(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> creditRequestQueue.listByUser(callerResolver.requireUser(userId).getId()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
