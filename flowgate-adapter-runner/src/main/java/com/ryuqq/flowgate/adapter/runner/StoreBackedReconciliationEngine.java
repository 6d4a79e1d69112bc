package com.ryuqq.flowgate.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ryuqq.flowgate.application.reconciliation.ReconciliationEngine;
import com.ryuqq.flowgate.core.reconciliation.Candidate;
import com.ryuqq.flowgate.core.reconciliation.EntityRef;
import com.ryuqq.flowgate.core.reconciliation.Link;
import com.ryuqq.flowgate.core.reconciliation.ReconciliationConfig;
import com.ryuqq.flowgate.core.reconciliation.ReconciliationException;
import com.ryuqq.flowgate.core.reconciliation.ReconciliationResult;
import com.ryuqq.flowgate.core.reconciliation.TaskStatus;
import com.ryuqq.flowgate.core.reconciliation.VerificationTask;
import com.ryuqq.flowgate.core.spi.CandidateSearchClient;
import com.ryuqq.flowgate.core.spi.Clock;
import com.ryuqq.flowgate.core.spi.GenerationMismatchException;
import com.ryuqq.flowgate.core.spi.KeyValueStore;
import com.ryuqq.flowgate.core.spi.SearchOptions;
import com.ryuqq.flowgate.core.spi.StorageException;
import com.ryuqq.flowgate.core.spi.VersionedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link KeyValueStore} 기반 ReconciliationEngine 구현체.
 *
 * <p><strong>저장 구조 (값은 JSON):</strong></p>
 * <pre>
 * links/&lt;URL 인코딩된 entityIri&gt;  → Link
 * queue/&lt;taskId&gt;                  → VerificationTask
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>{@link StorageException}, {@link JsonProcessingException} → {@link ReconciliationException}
 *       (엔티티 IRI 또는 작업 ID와 원인 포함)</li>
 *   <li>후보 검색 예외 → 감싸지 않고 그대로 전파</li>
 *   <li>목록 조회 중 손상된 작업 → WARN 로그 후 제외</li>
 *   <li>손상된 링크 → {@link #getLink(String)}는 WARN 로그 후 empty, Reconciliation은 기존 링크로 보고 SKIPPED</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 엔진 자체는 공유 가변 상태가 없습니다. 작업 상태 전이는
 * {@link KeyValueStore#putIfGeneration(String, String, long)}로 읽은 세대에 대해 조건부로 기록하므로,
 * 같은 작업에 대한 동시 승인/거부 중 하나만 성공하고 나머지는 {@link ReconciliationException}으로 실패합니다.
 * 승인 시 작업 전이를 먼저 기록하고 링크를 저장하므로, 전이에 실패한 승인은 링크를 남기지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StoreBackedReconciliationEngine implements ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(StoreBackedReconciliationEngine.class);

    static final String LINKS_PREFIX = "links/";
    static final String QUEUE_PREFIX = "queue/";

    /**
     * 기본 외부 엔티티 URI prefix (Wikidata).
     */
    public static final String DEFAULT_EXTERNAL_URI_PREFIX = "http://www.wikidata.org/entity/";

    private final KeyValueStore store;
    private final CandidateSearchClient searchClient;
    private final Clock clock;
    private final String externalUriPrefix;
    private final ReconciliationJsonCodec codec = new ReconciliationJsonCodec();
    private final TaskIdGenerator taskIds;

    /**
     * 시스템 시계와 Wikidata URI prefix를 사용하는 생성자.
     *
     * @param store 저장소
     * @param searchClient 후보 검색 클라이언트
     */
    public StoreBackedReconciliationEngine(KeyValueStore store, CandidateSearchClient searchClient) {
        this(store, searchClient, Clock.system(), DEFAULT_EXTERNAL_URI_PREFIX);
    }

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param searchClient 후보 검색 클라이언트
     * @param clock 시계 (링크/작업 생성 시각)
     * @param externalUriPrefix 외부 식별자 앞에 붙여 링크 URI를 만드는 prefix
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StoreBackedReconciliationEngine(
        KeyValueStore store,
        CandidateSearchClient searchClient,
        Clock clock,
        String externalUriPrefix
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (searchClient == null) {
            throw new IllegalArgumentException("searchClient cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (externalUriPrefix == null) {
            throw new IllegalArgumentException("externalUriPrefix cannot be null");
        }
        this.store = store;
        this.searchClient = searchClient;
        this.clock = clock;
        this.externalUriPrefix = externalUriPrefix;
        this.taskIds = new TaskIdGenerator(clock);
    }

    @Override
    public ReconciliationResult reconcileEntity(
        String entityIri,
        String label,
        List<String> types,
        ReconciliationConfig config
    ) {
        requireText("entityIri", entityIri);
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        log.debug("Reconciling entity {} (label={}, types={})", entityIri, label, types);

        // 1. 기존 링크 레코드 → SKIPPED (검색 없음, 디코딩 여부 무관)
        if (read(linkKey(entityIri), entityIri, null).isPresent()) {
            log.debug("Entity {} already linked, skipping", entityIri);
            return ReconciliationResult.skipped(entityIri, label);
        }

        // 2. 외부 레지스트리 검색 (예외는 그대로 전파)
        List<Candidate> candidates = searchClient.search(
            label,
            new SearchOptions(config.language(), config.maxCandidates())
        );
        if (candidates == null || candidates.isEmpty()) {
            log.debug("No candidates for {}", entityIri);
            return ReconciliationResult.noMatch(entityIri, label, List.of());
        }

        // 3. 최선 후보 점수로 결정
        Candidate best = candidates.get(0);
        if (best.score() >= config.autoLinkThreshold()) {
            storeLink(entityIri, best.id());
            log.info("Auto-linked {} → {} (score={})", entityIri, best.id(), best.score());
            return ReconciliationResult.autoLinked(entityIri, label, candidates);
        }
        if (best.score() >= config.queueThreshold()) {
            String taskId = queueForVerification(entityIri, label, candidates);
            log.info("Queued {} for verification as {} (best={}, score={})",
                entityIri, taskId, best.id(), best.score());
            return ReconciliationResult.queued(entityIri, label, candidates, taskId);
        }

        log.debug("No match for {} (best score {} below {})", entityIri, best.score(), config.queueThreshold());
        return ReconciliationResult.noMatch(entityIri, label, candidates);
    }

    @Override
    public List<ReconciliationResult> reconcileBatch(List<EntityRef> entities, ReconciliationConfig config) {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        List<ReconciliationResult> results = new ArrayList<>(entities.size());
        for (EntityRef entity : entities) {
            results.add(reconcileEntity(entity.iri(), entity.label(), entity.types(), config));
        }
        log.info("Reconciled batch of {} entities", results.size());
        return results;
    }

    @Override
    public String queueForVerification(String entityIri, String label, List<Candidate> candidates) {
        requireText("entityIri", entityIri);
        String taskId = taskIds.nextId();
        VerificationTask task = VerificationTask.pending(
            taskId, entityIri, label, candidates, clock.currentTimeMillis());
        try {
            store.putIfGeneration(QUEUE_PREFIX + taskId, codec.encodeTask(task), 0);
        } catch (StorageException | JsonProcessingException e) {
            throw new ReconciliationException(
                "Failed to queue verification for " + entityIri, entityIri, taskId, e);
        }
        return taskId;
    }

    @Override
    public void approveTask(String taskId, String chosenId) {
        requireText("chosenId", chosenId);
        StoredTask stored = requirePendingTask(taskId);
        VerificationTask task = stored.task();

        writeTask(task.approvedWith(chosenId), stored.generation());
        storeLink(task.entityIri(), chosenId);
        log.info("Approved task {}: {} → {}", taskId, task.entityIri(), chosenId);
    }

    @Override
    public void rejectTask(String taskId) {
        StoredTask stored = requirePendingTask(taskId);
        VerificationTask task = stored.task();

        writeTask(task.rejected(), stored.generation());
        log.info("Rejected task {} for {}", taskId, task.entityIri());
    }

    @Override
    public List<VerificationTask> getPendingTasks() {
        List<String> keys;
        try {
            keys = store.list(QUEUE_PREFIX);
        } catch (StorageException e) {
            throw new ReconciliationException("Failed to list verification tasks", null, null, e);
        }

        List<VerificationTask> pending = new ArrayList<>();
        for (String key : keys) {
            Optional<String> json = read(key, null, key.substring(QUEUE_PREFIX.length()));
            if (json.isEmpty()) {
                continue;
            }
            try {
                VerificationTask task = codec.decodeTask(json.get());
                if (task.status() == TaskStatus.PENDING) {
                    pending.add(task);
                }
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed verification task at {}: {}", key, e.getOriginalMessage());
            }
        }

        pending.sort(Comparator.comparingLong(VerificationTask::createdAt).thenComparing(VerificationTask::id));
        return pending;
    }

    @Override
    public Optional<VerificationTask> getTask(String taskId) {
        requireText("taskId", taskId);
        return readTask(taskId).map(StoredTask::task);
    }

    @Override
    public Optional<Link> getLink(String entityIri) {
        requireText("entityIri", entityIri);
        String key = linkKey(entityIri);
        Optional<String> json = read(key, entityIri, null);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decodeLink(json.get()));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed link at {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * 링크 저장 키.
     *
     * <p>IRI의 '/', ':', '#' 등이 키 구분자와 섞이지 않도록 URL 인코딩하며, 공백은 {@code %20}으로 표기합니다.</p>
     *
     * @param entityIri 엔티티 IRI
     * @return {@code links/<encoded>}
     */
    static String linkKey(String entityIri) {
        return LINKS_PREFIX + URLEncoder.encode(entityIri, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private StoredTask requirePendingTask(String taskId) {
        requireText("taskId", taskId);
        StoredTask stored = readTask(taskId)
            .orElseThrow(() -> ReconciliationException.forTask("Verification task not found", taskId, null));
        VerificationTask task = stored.task();
        if (task.status() != TaskStatus.PENDING) {
            throw new ReconciliationException(
                "Verification task " + taskId + " is already " + task.status(), task.entityIri(), taskId, null);
        }
        return stored;
    }

    private Optional<StoredTask> readTask(String taskId) {
        String key = QUEUE_PREFIX + taskId;
        Optional<VersionedValue> versioned;
        try {
            versioned = store.getVersioned(key);
        } catch (StorageException e) {
            throw new ReconciliationException("Failed to read " + key, null, taskId, e);
        }
        if (versioned.isEmpty()) {
            return Optional.empty();
        }
        try {
            VersionedValue value = versioned.get();
            return Optional.of(new StoredTask(codec.decodeTask(value.value()), value.generation()));
        } catch (JsonProcessingException e) {
            throw ReconciliationException.forTask("Malformed verification task", taskId, e);
        }
    }

    private void storeLink(String entityIri, String externalId) {
        Link link = new Link(entityIri, externalId, externalUriPrefix + externalId, clock.currentTimeMillis());
        try {
            store.put(linkKey(entityIri), codec.encodeLink(link));
        } catch (StorageException | JsonProcessingException e) {
            throw ReconciliationException.forEntity("Failed to store link", entityIri, e);
        }
        log.debug("Stored link {} → {}", entityIri, externalId);
    }

    private void writeTask(VerificationTask task, long expectedGeneration) {
        try {
            store.putIfGeneration(QUEUE_PREFIX + task.id(), codec.encodeTask(task), expectedGeneration);
        } catch (GenerationMismatchException e) {
            throw new ReconciliationException(
                "Verification task " + task.id() + " was modified concurrently", task.entityIri(), task.id(), e);
        } catch (StorageException | JsonProcessingException e) {
            throw new ReconciliationException(
                "Failed to update verification task " + task.id(), task.entityIri(), task.id(), e);
        }
    }

    private Optional<String> read(String key, String entityIri, String taskId) {
        try {
            return store.get(key);
        } catch (StorageException e) {
            throw new ReconciliationException("Failed to read " + key, entityIri, taskId, e);
        }
    }

    private record StoredTask(VerificationTask task, long generation) {
    }

    private static void requireText(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
