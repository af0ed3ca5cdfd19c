package ai.keynav.blocks;

/** Fire-and-forget sound output. Implementations must never throw from these methods. */
public interface AudioFeedback {
    AudioFeedback SILENT = new AudioFeedback() {
        @Override
        public void play(String name, double volume) {}

        @Override
        public void beep(int toneHz) {}
    };

    void play(String name, double volume);

    default void play(String name) {
        play(name, 1.0);
    }

    /** Short synthesized tone, used to signal changes of nesting depth. */
    void beep(int toneHz);
}
