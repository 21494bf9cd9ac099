package me.willkroboth.vmcontrol.actor;

/**
 * Judges a test case after its input has been typed into the guest.
 */
@FunctionalInterface
public interface TestEvaluator {
    boolean evaluate(String vmName, String testId, String typedText) throws InterruptedException;

    // Passes whenever the text was typed without an error
    static TestEvaluator typedSuccessfully() {
        return (vmName, testId, typedText) -> true;
    }
}
