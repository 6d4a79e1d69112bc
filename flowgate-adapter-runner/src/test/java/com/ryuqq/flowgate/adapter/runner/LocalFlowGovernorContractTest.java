package com.ryuqq.flowgate.adapter.runner;

import com.ryuqq.flowgate.core.protection.FlowGovernor;
import com.ryuqq.flowgate.core.protection.GovernorConfig;
import com.ryuqq.flowgate.core.spi.Clock;
import com.ryuqq.flowgate.testkit.contract.AbstractFlowGovernorContractTest;

/**
 * LocalFlowGovernor Contract Test.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LocalFlowGovernorContractTest extends AbstractFlowGovernorContractTest {

    @Override
    protected FlowGovernor createGovernor(GovernorConfig config, Clock clock) {
        return new LocalFlowGovernor(config, clock);
    }
}
