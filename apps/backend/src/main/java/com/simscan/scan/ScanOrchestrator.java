package com.simscan.scan;

import com.simscan.config.ScanProperties;
import com.simscan.corpus.CorpusEntry;
import com.simscan.corpus.CorpusStore;
import com.simscan.document.domain.CorpusDocument;
import com.simscan.document.service.DocumentService;
import com.simscan.error.InsufficientCreditException;
import com.simscan.error.SimScanException;
import com.simscan.error.StorageException;
import com.simscan.error.ValidationException;
import com.simscan.ledger.CreditLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one scan: deduct a credit, persist the submission, compare it against the rest of the corpus.
 *
 * <p>The credit is taken before the body is stored. A storage fault after the deduction leaves the
 * user debited with no document unless {@link ScanProperties#isRefundOnStorageFailure()} is on.</p>
 */
@Slf4j
@Service
public class ScanOrchestrator {

    private final CreditLedger ledger;
    private final CorpusStore corpusStore;
    private final DocumentService documentService;
    private final SimilarityMetric metric;
    private final ScanProperties props;
    private final Scheduler compareScheduler;

    public ScanOrchestrator(CreditLedger ledger,
                            CorpusStore corpusStore,
                            DocumentService documentService,
                            SimilarityMetric metric,
                            ScanProperties props,
                            Scheduler compareScheduler) {
        this.ledger = ledger;
        this.corpusStore = corpusStore;
        this.documentService = documentService;
        this.metric = metric;
        this.props = props;
        this.compareScheduler = compareScheduler;
    }

    public Mono<ScanResult> submitScan(long userId, String text, String fileName) {
        return Mono.defer(() -> {
            validate(text, fileName);
            logState(userId, fileName, ScanState.RECEIVED);

            int cost = props.getCostPerScan();
            return Mono.fromCallable(() -> ledger.tryDeduct(userId, cost))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(deducted -> {
                        if (!deducted) {
                            log.info("[SCAN] user={} file={} state={} reason=insufficient_credit",
                                    userId, fileName, ScanState.REJECTED);
                            return Mono.error(new InsufficientCreditException(userId, cost));
                        }
                        logState(userId, fileName, ScanState.CREDIT_CHECKED);
                        return persist(userId, text, fileName, cost)
                                .flatMap(doc -> compare(doc, text));
                    });
        });
    }

    private void validate(String text, String fileName) {
        // 只要求非空，纯空白文本照常扫描
        if (!StringUtils.hasLength(text) || !StringUtils.hasLength(fileName)) {
            throw new ValidationException("Text content and file name are required!");
        }
    }

    private Mono<CorpusDocument> persist(long userId, String text, String fileName, int cost) {
        String storageKey = corpusStore.allocateKey(fileName);
        return corpusStore.put(storageKey, text, props.getStorageTimeout())
                .then(Mono.fromCallable(() -> documentService.record(
                                userId, storageKey, fileName, text.getBytes(StandardCharsets.UTF_8)))
                        .subscribeOn(Schedulers.boundedElastic()))
                .onErrorMap(e -> !(e instanceof SimScanException),
                        e -> new StorageException("Failed to record document " + storageKey, e))
                .doOnNext(doc -> log.debug("[SCAN] user={} file={} state={} documentId={} key={}",
                        userId, fileName, ScanState.PERSISTED, doc.getId(), storageKey))
                .onErrorResume(StorageException.class, e -> failAfterDeduction(userId, fileName, storageKey, cost, e));
    }

    private Mono<CorpusDocument> failAfterDeduction(long userId, String fileName, String storageKey,
                                                    int cost, StorageException error) {
        log.error("[SCAN] user={} file={} key={} state={} credits already deducted",
                userId, fileName, storageKey, ScanState.FAILED, error);
        if (!props.isRefundOnStorageFailure()) {
            return Mono.error(error);
        }
        return Mono.fromRunnable(() -> ledger.grant(userId, cost))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(v -> log.warn("[SCAN] user={} refunded amount={} after storage failure", userId, cost))
                .onErrorResume(refundError -> {
                    log.error("[SCAN] user={} refund of amount={} failed", userId, cost, refundError);
                    error.addSuppressed(refundError);
                    return Mono.empty();
                })
                .then(Mono.error(error));
    }

    private Mono<ScanResult> compare(CorpusDocument doc, String text) {
        AtomicInteger compared = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();

        return corpusStore.listExcept(doc.getStorageKey())
                .flatMapSequential(entry -> score(entry, text, compared, skipped), props.getCompareParallelism())
                .filter(scored -> scored.score() > props.getThreshold())
                .map(scored -> Match.of(scored.entry().displayName(), scored.score()))
                .collectList()
                .doOnNext(matches -> log.debug("[SCAN] user={} file={} state={} compared={} skipped={} matches={}",
                        doc.getUserId(), doc.getFileName(), ScanState.COMPARED, compared.get(), skipped.get(), matches.size()))
                .flatMap(matches -> Mono.fromCallable(() -> ledger.balanceOf(doc.getUserId()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .map(creditsLeft -> complete(doc, creditsLeft, matches, compared.get(), skipped.get())));
    }

    private Mono<Scored> score(CorpusEntry entry, String text, AtomicInteger compared, AtomicInteger skipped) {
        return corpusStore.read(entry.storageKey(), props.getStorageTimeout())
                .publishOn(compareScheduler)
                .map(existing -> new Scored(entry, metric.similarity(text, existing)))
                .doOnNext(scored -> {
                    compared.incrementAndGet();
                    log.debug("[SCAN] compared key={} name={} similarity={}",
                            entry.storageKey(), entry.displayName(), scored.score());
                })
                .doOnError(RejectedExecutionException.class, e ->
                        log.error("[SCAN] compare pool saturated, aborting scan at key={}", entry.storageKey()))
                .onErrorResume(SimScanException.class, e -> {
                    skipped.incrementAndGet();
                    log.warn("[SCAN] skipping document id={} key={}: {}",
                            entry.documentId(), entry.storageKey(), e.getMessage());
                    return Mono.empty();
                });
    }

    private ScanResult complete(CorpusDocument doc, int creditsLeft, List<Match> matches, int compared, int skipped) {
        log.info("[SCAN] user={} file={} state={} documentId={} matches={} skipped={} creditsLeft={}",
                doc.getUserId(), doc.getFileName(), ScanState.COMPLETED, doc.getId(), matches.size(), skipped, creditsLeft);
        return ScanResult.builder()
                .state(ScanState.COMPLETED)
                .documentId(doc.getId())
                .storageKey(doc.getStorageKey())
                .fileName(doc.getFileName())
                .creditsLeft(creditsLeft)
                .matches(List.copyOf(matches))
                .comparedDocuments(compared)
                .skippedDocuments(skipped)
                .build();
    }

    private void logState(long userId, String fileName, ScanState state) {
        log.debug("[SCAN] user={} file={} state={}", userId, fileName, state);
    }

    private record Scored(CorpusEntry entry, double score) {}
}
