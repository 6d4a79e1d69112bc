package com.ryuqq.flowgate.application.reconciliation;

import com.ryuqq.flowgate.core.reconciliation.Candidate;
import com.ryuqq.flowgate.core.reconciliation.EntityRef;
import com.ryuqq.flowgate.core.reconciliation.Link;
import com.ryuqq.flowgate.core.reconciliation.ReconciliationConfig;
import com.ryuqq.flowgate.core.reconciliation.ReconciliationResult;
import com.ryuqq.flowgate.core.reconciliation.VerificationTask;

import java.util.List;
import java.util.Optional;

/**
 * Entity Reconciliation 엔진.
 *
 * <p>엔티티 레이블을 외부 레지스트리에 대조하여 자동 링크, 검토 대기, 불일치 중 하나로 결정하고,
 * 검토 대기 건의 승인/거부 워크플로를 제공합니다.</p>
 *
 * <p><strong>오류 구분:</strong></p>
 * <ul>
 *   <li>저장소 읽기/쓰기/직렬화 실패 → {@link com.ryuqq.flowgate.core.reconciliation.ReconciliationException}</li>
 *   <li>외부 레지스트리 실패 → {@link com.ryuqq.flowgate.core.spi.CandidateSearchException} (감싸지 않음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ReconciliationEngine {

    /**
     * 단일 엔티티 Reconciliation.
     *
     * <p>이미 링크가 있으면 외부 검색 없이 SKIPPED를 반환합니다.</p>
     *
     * @param entityIri 엔티티 IRI
     * @param label 검색 레이블
     * @param types 엔티티 타입 IRI 목록 (null 허용)
     * @param config 설정
     * @return ReconciliationResult
     */
    ReconciliationResult reconcileEntity(String entityIri, String label, List<String> types, ReconciliationConfig config);

    /**
     * 기본 설정으로 단일 엔티티 Reconciliation.
     *
     * @param entityIri 엔티티 IRI
     * @param label 검색 레이블
     * @return ReconciliationResult
     */
    default ReconciliationResult reconcileEntity(String entityIri, String label) {
        return reconcileEntity(entityIri, label, List.of(), new ReconciliationConfig());
    }

    /**
     * 일괄 Reconciliation.
     *
     * <p>외부 레지스트리의 rate limit을 넘지 않도록 항상 한 건씩 순서대로 처리하며,
     * 첫 실패에서 중단하고 예외를 전파합니다.</p>
     *
     * @param entities 대상 엔티티 목록
     * @param config 설정
     * @return 입력 순서와 같은 순서의 결과 목록
     */
    List<ReconciliationResult> reconcileBatch(List<EntityRef> entities, ReconciliationConfig config);

    /**
     * 검증 작업 생성.
     *
     * @param entityIri 엔티티 IRI
     * @param label 레이블
     * @param candidates 후보 목록
     * @return 생성된 작업 ID
     */
    String queueForVerification(String entityIri, String label, List<Candidate> candidates);

    /**
     * 검증 작업 승인.
     *
     * <p>선택된 외부 식별자로 링크를 저장하고 작업을 APPROVED로 기록합니다.</p>
     *
     * @param taskId 작업 ID
     * @param chosenId 선택된 외부 식별자
     * @throws com.ryuqq.flowgate.core.reconciliation.ReconciliationException 작업이 없거나 PENDING이 아닌 경우
     */
    void approveTask(String taskId, String chosenId);

    /**
     * 검증 작업 거부.
     *
     * @param taskId 작업 ID
     * @throws com.ryuqq.flowgate.core.reconciliation.ReconciliationException 작업이 없거나 PENDING이 아닌 경우
     */
    void rejectTask(String taskId);

    /**
     * 검토 대기 작업 목록 (생성 시각 오름차순).
     *
     * <p>역직렬화할 수 없는 레코드는 목록에서 제외됩니다.</p>
     *
     * @return PENDING 작업 목록
     */
    List<VerificationTask> getPendingTasks();

    /**
     * 작업 조회.
     *
     * @param taskId 작업 ID
     * @return 작업 (없으면 empty)
     */
    Optional<VerificationTask> getTask(String taskId);

    /**
     * 링크 조회.
     *
     * @param entityIri 엔티티 IRI
     * @return 링크 (없거나 손상된 경우 empty)
     */
    Optional<Link> getLink(String entityIri);
}
