/**
 * Abstract contract tests for Flowgate SPI and engine implementations.
 *
 * <p>Adapter modules extend these classes in their own test sources to prove they honor
 * the shared behavioral contract.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flowgate.testkit.contract;
