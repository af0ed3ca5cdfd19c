package ai.keynav.audio;

import ai.keynav.blocks.AudioFeedback;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.FloatControl;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Plays named sound clips and synthesized beeps through {@code javax.sound.sampled}. Sounds unknown to this instance
 * are handed to the parent audio, if any. Playback problems (no mixer, unsupported format) are logged and ignored.
 */
public class WorkspaceAudio implements AudioFeedback {
    private static final Logger logger = LogManager.getLogger(WorkspaceAudio.class);

    /** A sound is dropped if another one started less than this many milliseconds earlier. */
    static final long SOUND_LIMIT_MS = 100;

    static final float SAMPLE_RATE = 44_100f;
    static final int BEEP_MILLIS = 120;
    static final AudioFormat TONE_FORMAT = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);

    record Sound(AudioFormat format, byte[] data) {}

    private final @Nullable AudioFeedback parent;
    private final LongSupplier clock;
    private final Map<String, Sound> sounds = new ConcurrentHashMap<>();
    private @Nullable Long lastSoundAt;
    private volatile boolean muted;

    public WorkspaceAudio(@Nullable AudioFeedback parent) {
        this(parent, System::currentTimeMillis);
    }

    WorkspaceAudio(@Nullable AudioFeedback parent, LongSupplier clock) {
        this.parent = parent;
        this.clock = clock;
    }

    /** Loads the first of {@code files} under {@code name}. Later files are alternatives that are not tried. */
    public void load(List<Path> files, String name) {
        if (files.isEmpty()) {
            return;
        }
        var file = files.get(0);
        try (var in = AudioSystem.getAudioInputStream(file.toFile())) {
            sounds.put(name, new Sound(in.getFormat(), in.readAllBytes()));
            logger.debug("Loaded sound {} from {}", name, file);
        } catch (UnsupportedAudioFileException | IOException e) {
            logger.warn("Could not load sound {} from {}: {}", name, file, e.getMessage());
        }
    }

    /** Registers already decoded PCM data under {@code name}. */
    public void register(String name, AudioFormat format, byte[] data) {
        sounds.put(name, new Sound(format, data.clone()));
    }

    public boolean hasSound(String name) {
        return sounds.containsKey(name);
    }

    @Override
    public void play(String name, double volume) {
        if (muted || volume == 0) {
            return;
        }
        var sound = sounds.get(name);
        if (sound == null) {
            if (parent != null) {
                parent.play(name, volume);
            } else {
                logger.debug("No sound named {}", name);
            }
            return;
        }
        if (!claimSlot()) {
            return;
        }
        playSafely(sound.format(), sound.data(), volume);
    }

    @Override
    public void beep(int toneHz) {
        if (muted) {
            return;
        }
        playSafely(TONE_FORMAT, synthesizeTone(toneHz, BEEP_MILLIS), 1.0);
    }

    private synchronized boolean claimSlot() {
        long now = clock.getAsLong();
        if (lastSoundAt != null && now - lastSoundAt < SOUND_LIMIT_MS) {
            return false;
        }
        lastSoundAt = now;
        return true;
    }

    private void playSafely(AudioFormat format, byte[] data, double volume) {
        try {
            startPlayback(format, data, volume);
        } catch (LineUnavailableException | IllegalArgumentException | IllegalStateException | SecurityException e) {
            logger.warn("Audio playback failed: {}", e.getMessage());
        }
    }

    /** Opens a clip and starts it without waiting for it to finish. */
    protected void startPlayback(AudioFormat format, byte[] data, double volume) throws LineUnavailableException {
        var clip = AudioSystem.getClip();
        clip.open(format, data, 0, data.length);
        if (volume < 1.0 && clip.isControlSupported(FloatControl.Type.MASTER_GAIN)) {
            var gain = (FloatControl) clip.getControl(FloatControl.Type.MASTER_GAIN);
            float db = (float) (20 * Math.log10(volume));
            gain.setValue(Math.max(gain.getMinimum(), Math.min(gain.getMaximum(), db)));
        }
        clip.addLineListener(event -> {
            if (event.getType() == LineEvent.Type.STOP) {
                clip.close();
            }
        });
        clip.start();
    }

    /** 16-bit little-endian mono sine wave with a short fade at both ends to avoid clicks. */
    static byte[] synthesizeTone(int toneHz, int millis) {
        int samples = (int) (SAMPLE_RATE * millis / 1000);
        int fade = Math.max(1, samples / 10);
        var data = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            double envelope = Math.min(1.0, Math.min(i, samples - 1 - i) / (double) fade);
            double value = Math.sin(2 * Math.PI * toneHz * i / SAMPLE_RATE) * envelope * 0.5;
            short sample = (short) Math.round(value * Short.MAX_VALUE);
            data[2 * i] = (byte) (sample & 0xff);
            data[2 * i + 1] = (byte) ((sample >> 8) & 0xff);
        }
        return data;
    }

    public boolean isMuted() {
        return muted;
    }

    public void setMuted(boolean muted) {
        this.muted = muted;
    }

    public void dispose() {
        sounds.clear();
    }
}
