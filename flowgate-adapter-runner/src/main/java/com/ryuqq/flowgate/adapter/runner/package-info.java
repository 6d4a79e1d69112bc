/**
 * Flowgate Runner Adapter - SPI 기반 런타임 구현체.
 *
 * <h2>핵심 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowgate.adapter.runner.LocalFlowGovernor} - 프로세스 로컬 Rate Limiter + Circuit Breaker + Bulkhead</li>
 *   <li>{@link com.ryuqq.flowgate.adapter.runner.ScopedGovernedInvoker} - try/finally 기반 보호 호출</li>
 *   <li>{@link com.ryuqq.flowgate.adapter.runner.StoreBackedReconciliationEngine} - KeyValueStore 기반 Reconciliation</li>
 * </ul>
 *
 * <h2>의존성</h2>
 * <ul>
 *   <li>SLF4J: 상태 전이 및 결정 로깅</li>
 *   <li>Jackson Databind: 링크/검증 작업 JSON 직렬화</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.adapter.runner;
