package com.simscan.controller;

import com.simscan.api.dto.ScanRequest;
import com.simscan.api.dto.ScanResponse;
import com.simscan.scan.ScanOrchestrator;
import com.simscan.user.CallerResolver;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequiredArgsConstructor
public class ScanController {

    private final ScanOrchestrator orchestrator;
    private final CallerResolver callerResolver;

    /**
     * 提交文本并扣除 1 点，返回与已有文档的相似度匹配
     *
     * JSON 字段：
     * - text: 文档正文（必填）
     * - fileName: 文件名（必填）
     */
    @Operation(summary = "Submit a document and scan it against the stored corpus (costs one credit)")
    @PostMapping(
            value = "/scan",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ScanResponse> scan(@RequestHeader(value = CallerResolver.USER_HEADER, required = false) String userId,
                                   @RequestBody ScanRequest request) {
        return Mono.fromCallable(() -> callerResolver.requireUser(userId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(caller -> orchestrator.submitScan(caller.getId(), request.text(), request.fileName()))
                .map(ScanResponse::from);
    }
}
