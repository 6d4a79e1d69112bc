package com.ryuqq.flowgate.core.reconciliation;

/**
 * Reconciliation 기록 실패.
 *
 * <p>링크/검증 작업 저장소의 읽기·쓰기·직렬화 실패, 존재하지 않는 작업, 종료 상태 작업에 대한
 * 전이 시도를 하나의 오류 타입으로 표현합니다. 대상 엔티티 IRI 또는 작업 ID와 원인을 함께 전달합니다.</p>
 *
 * <p>외부 레지스트리 오류({@code CandidateSearchException})는 이 타입으로 감싸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ReconciliationException extends RuntimeException {

    private final String entityIri;
    private final String taskId;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param entityIri 대상 엔티티 IRI (null 가능)
     * @param taskId 대상 작업 ID (null 가능)
     * @param cause 원인 (null 가능)
     */
    public ReconciliationException(String message, String entityIri, String taskId, Throwable cause) {
        super(message, cause);
        this.entityIri = entityIri;
        this.taskId = taskId;
    }

    /**
     * 엔티티 문맥의 예외 생성.
     *
     * @param message 오류 메시지
     * @param entityIri 엔티티 IRI
     * @param cause 원인
     * @return ReconciliationException
     */
    public static ReconciliationException forEntity(String message, String entityIri, Throwable cause) {
        return new ReconciliationException(message + ": " + entityIri, entityIri, null, cause);
    }

    /**
     * 작업 문맥의 예외 생성.
     *
     * @param message 오류 메시지
     * @param taskId 작업 ID
     * @param cause 원인 (null 가능)
     * @return ReconciliationException
     */
    public static ReconciliationException forTask(String message, String taskId, Throwable cause) {
        return new ReconciliationException(message + ": " + taskId, null, taskId, cause);
    }

    public String getEntityIri() {
        return entityIri;
    }

    public String getTaskId() {
        return taskId;
    }
}
