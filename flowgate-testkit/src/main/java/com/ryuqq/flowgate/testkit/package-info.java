/**
 * Test fixtures for Flowgate SPI consumers.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowgate.testkit.ManualClock} - deterministic time</li>
 *   <li>{@link com.ryuqq.flowgate.testkit.StubCandidateSearchClient} - programmable registry</li>
 *   <li>{@link com.ryuqq.flowgate.testkit.FaultyKeyValueStore} - storage failure injection</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.testkit;
