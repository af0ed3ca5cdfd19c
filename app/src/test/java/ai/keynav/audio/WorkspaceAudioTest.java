package ai.keynav.audio;

import static org.junit.jupiter.api.Assertions.*;

import ai.keynav.testutil.RecordingAudio;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceAudioTest {
    private static final byte[] CLICK = new byte[] {1, 2, 3, 4};

    private final AtomicLong now = new AtomicLong(1_000);
    private RecordingAudio parent;
    private CapturingAudio audio;

    /** Records clips instead of opening a sound device. */
    static class CapturingAudio extends WorkspaceAudio {
        final List<AudioFormat> formats = new ArrayList<>();
        final List<byte[]> clips = new ArrayList<>();
        boolean failWithUnavailableLine;

        CapturingAudio(RecordingAudio parent, AtomicLong clock) {
            super(parent, clock::get);
        }

        @Override
        protected void startPlayback(AudioFormat format, byte[] data, double volume)
                throws LineUnavailableException {
            if (failWithUnavailableLine) {
                throw new LineUnavailableException("no mixer");
            }
            formats.add(format);
            clips.add(data);
        }
    }

    @BeforeEach
    void setUp() {
        parent = new RecordingAudio();
        audio = new CapturingAudio(parent, now);
        audio.register("click", WorkspaceAudio.TONE_FORMAT, CLICK);
    }

    @Test
    void playsRegisteredSound() {
        audio.play("click");
        assertEquals(1, audio.clips.size());
        assertArrayEquals(CLICK, audio.clips.get(0));
        assertTrue(parent.played.isEmpty());
    }

    @Test
    void soundsCloserThanLimitAreDropped() {
        audio.play("click");
        now.addAndGet(WorkspaceAudio.SOUND_LIMIT_MS - 1);
        audio.play("click");
        assertEquals(1, audio.clips.size());

        now.addAndGet(1);
        audio.play("click");
        assertEquals(2, audio.clips.size());
    }

    @Test
    void unknownSoundsGoToParent() {
        audio.play("delete", 0.5);
        assertEquals(List.of("delete"), parent.played);
        assertTrue(audio.clips.isEmpty());

        var orphan = new WorkspaceAudio(null);
        assertDoesNotThrow(() -> orphan.play("delete"));
    }

    @Test
    void mutedOrSilentPlaysNothing() {
        audio.play("click", 0);
        audio.setMuted(true);
        assertTrue(audio.isMuted());
        audio.play("click");
        audio.beep(440);
        assertTrue(audio.clips.isEmpty());
    }

    @Test
    void beepSynthesizesToneWithoutThrottling() {
        audio.beep(400);
        audio.beep(440);

        assertEquals(2, audio.clips.size());
        assertEquals(WorkspaceAudio.TONE_FORMAT, audio.formats.get(0));
        int samples = (int) (WorkspaceAudio.SAMPLE_RATE * WorkspaceAudio.BEEP_MILLIS / 1000);
        assertEquals(samples * 2, audio.clips.get(0).length);
    }

    @Test
    void toneFadesInFromSilence() {
        var tone = WorkspaceAudio.synthesizeTone(440, 10);
        assertEquals(0, tone[0]);
        assertEquals(0, tone[1]);
        boolean audible = false;
        for (byte b : tone) {
            audible |= b != 0;
        }
        assertTrue(audible);
    }

    @Test
    void playbackFailuresAreSwallowed() {
        audio.failWithUnavailableLine = true;
        assertDoesNotThrow(() -> audio.play("click"));
        assertDoesNotThrow(() -> audio.beep(400));
    }

    @Test
    void loadsWaveFiles(@TempDir Path tempDir) throws IOException {
        var wav = tempDir.resolve("ding.wav");
        var pcm = WorkspaceAudio.synthesizeTone(880, 20);
        try (var in = new AudioInputStream(
                new ByteArrayInputStream(pcm), WorkspaceAudio.TONE_FORMAT, pcm.length / 2)) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, wav.toFile());
        }

        audio.load(List.of(tempDir.resolve("missing.wav")), "missing");
        audio.load(List.of(wav, tempDir.resolve("ignored.mp3")), "ding");
        audio.load(List.of(), "nothing");

        assertFalse(audio.hasSound("missing"));
        assertFalse(audio.hasSound("nothing"));
        assertTrue(audio.hasSound("ding"));

        audio.play("ding");
        assertArrayEquals(pcm, audio.clips.get(0));

        audio.dispose();
        assertFalse(audio.hasSound("ding"));
    }
}
