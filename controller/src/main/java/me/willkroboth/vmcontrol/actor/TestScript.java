package me.willkroboth.vmcontrol.actor;

/**
 * Decides what a test case types into the guest.
 */
@FunctionalInterface
public interface TestScript {
    String inputFor(String testId);

    static TestScript constant(String text) {
        return testId -> text;
    }

    static TestScript helloWorld() {
        return constant("Hello World");
    }
}
