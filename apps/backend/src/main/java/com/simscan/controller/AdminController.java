package com.simscan.controller;

import com.simscan.analytics.AnalyticsService;
import com.simscan.api.dto.DocumentView;
import com.simscan.credit.CreditRequestQueue;
import com.simscan.credit.domain.CreditRequest;
import com.simscan.document.service.DocumentService;
import com.simscan.user.CallerResolver;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final CallerResolver callerResolver;
    private final CreditRequestQueue creditRequestQueue;
    private final DocumentService documentService;
    private final AnalyticsService analyticsService;

    @Operation(summary = "待审批的积分申请")
    @GetMapping(value = "/credit-requests", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<CreditRequest>> pending(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> {
            callerResolver.requireAdmin(userId);
            return creditRequestQueue.listPending();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "所有已上传文档")
    @GetMapping(value = "/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<DocumentView>> documents(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> {
            callerResolver.requireAdmin(userId);
            return documentService.listAll().stream().map(DocumentView::from).toList();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "批准积分申请并发放积分")
    @PostMapping(value = "/approve-request/{requestId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> approve(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId,
                                             @PathVariable long requestId) {
        return Mono.fromCallable(() -> {
            var admin = callerResolver.requireAdmin(userId);
            CreditRequest decided = creditRequestQueue.approve(requestId, admin);
            log.debug("[ADMIN][POST]/approve-request/{} by={}", requestId, admin.getUsername());
            return Map.<String, Object>of(
                    "message", "Credit request approved successfully!",
                    "request", decided
            );
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "拒绝积分申请")
    @PostMapping(value = "/reject-request/{requestId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> reject(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId,
                                            @PathVariable long requestId) {
        return Mono.fromCallable(() -> {
            var admin = callerResolver.requireAdmin(userId);
            CreditRequest decided = creditRequestQueue.reject(requestId, admin);
            log.debug("[ADMIN][POST]/reject-request/{} by={}", requestId, admin.getUsername());
            return Map.<String, Object>of(
                    "message", "Credit request rejected.",
                    "request", decided
            );
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "扫描统计：总数、活跃用户、高频词")
    @GetMapping(value = "/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AnalyticsService.Report> analytics(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> callerResolver.requireAdmin(userId))
                .subscribeOn(Schedulers.boundedElastic())
                .then(analyticsService.report());
    }
}
