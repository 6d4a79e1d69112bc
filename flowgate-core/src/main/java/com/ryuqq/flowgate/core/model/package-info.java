/**
 * 공통 값 객체 패키지.
 *
 * <p>여러 계층(캐시, 큐, 저장소)에서 공유되는 불변 식별자를 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.core.model;
