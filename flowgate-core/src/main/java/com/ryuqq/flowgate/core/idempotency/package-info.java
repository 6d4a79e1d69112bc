/**
 * 멱등성 키 도출 패키지.
 *
 * <p>{@link com.ryuqq.flowgate.core.idempotency.IdempotencyKeyDeriver}는 외부 호출 단위 작업에 대해
 * 내용 기반의 결정적 식별자를 만듭니다. 하위 계층(캐시, 큐, 저장소)은 키당 하나의 활성 계산만
 * 존재한다고 가정하므로, 결정성은 타협할 수 없는 속성입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.core.idempotency;
