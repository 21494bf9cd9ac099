package me.willkroboth.vmcontrol.actor;

import me.willkroboth.vmcontrol.config.ControllerConfig;
import me.willkroboth.vmcontrol.keymapping.KeyCompiler;

/**
 * Collaborators shared by every actor an orchestrator starts. None of them hold per-VM state.
 */
public record ActorServices(
    KeyCompiler keyCompiler,
    AgentSignal agentSignal,
    TestScript testScript,
    TestEvaluator testEvaluator,
    ControllerConfig config
) {
    public ActorServices {
        if (keyCompiler == null || agentSignal == null || testScript == null || testEvaluator == null || config == null) {
            throw new NullPointerException("Every actor service must be given");
        }
    }

    /**
     * Uses the configured keyboard layout and the default test script and evaluator.
     */
    public static ActorServices create(ControllerConfig config, AgentSignal agentSignal) {
        return new ActorServices(
            new KeyCompiler(config.keyboardLayout()),
            agentSignal,
            TestScript.helloWorld(),
            TestEvaluator.typedSuccessfully(),
            config
        );
    }

    public ActorServices withTestScript(TestScript testScript) {
        return new ActorServices(keyCompiler, agentSignal, testScript, testEvaluator, config);
    }

    public ActorServices withTestEvaluator(TestEvaluator testEvaluator) {
        return new ActorServices(keyCompiler, agentSignal, testScript, testEvaluator, config);
    }
}
