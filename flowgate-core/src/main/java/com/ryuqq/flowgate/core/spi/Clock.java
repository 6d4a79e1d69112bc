package com.ryuqq.flowgate.core.spi;

/**
 * 시각 제공 SPI.
 *
 * <p>경과 시간 비교에 사용되는 epoch 밀리초를 제공합니다.
 * 테스트에서는 수동으로 진행시킬 수 있는 구현으로 교체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Clock {

    /**
     * 현재 시각 조회.
     *
     * @return epoch 밀리초
     */
    long currentTimeMillis();

    /**
     * 시스템 시계.
     *
     * @return {@link System#currentTimeMillis()} 기반 Clock
     */
    static Clock system() {
        return System::currentTimeMillis;
    }
}
