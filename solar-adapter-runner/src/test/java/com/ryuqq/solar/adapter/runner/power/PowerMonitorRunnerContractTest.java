package com.ryuqq.solar.adapter.runner.power;

import com.ryuqq.solar.adapter.runner.DefaultRunnerTypes;
import com.ryuqq.solar.application.runner.AbstractRunner;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.testkit.contract.AbstractRunnerContractTest;

import java.util.Random;

/**
 * PowerMonitorRunner 수명주기 계약 검증.
 *
 * @author Solar Team
 * @since 1.0.0
 */
class PowerMonitorRunnerContractTest extends AbstractRunnerContractTest {

    @Override
    protected String runnerType() {
        return DefaultRunnerTypes.POWER_MONITOR;
    }

    @Override
    protected AbstractRunner createRunner(RunnerSettings settings) {
        return new PowerMonitorRunner(settings, new SimulatedPowerSensor(new Random(7)));
    }

    @Override
    protected RunnerSettings contractSettings(String key) {
        return super.contractSettings(key).withProperty("log_measurements", false);
    }
}
