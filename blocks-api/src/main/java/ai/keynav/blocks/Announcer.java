package ai.keynav.blocks;

/** Sink for text that should be read out by assistive technology. */
@FunctionalInterface
public interface Announcer {
    void announce(String message);
}
