/**
 * Flow Governor 승인 결과 타입 패키지.
 *
 * <p>{@link com.ryuqq.flowgate.core.admission.Admission} sealed 계층으로 승인/거부 결과를 표현합니다.
 * 문자열 태그 대신 타입으로 구분하므로 호출자는 instanceof 분기로 모든 경우를 다룰 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.core.admission;
