package ou.capstone.fantasy;

/** Pauses between calls to the results website. Replaced in tests so nothing actually waits. */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper system() {
        return Thread::sleep;
    }
}
