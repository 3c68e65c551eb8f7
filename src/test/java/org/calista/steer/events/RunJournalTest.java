package org.calista.steer.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.steer.generate.GenerationResult;
import org.calista.steer.io.FileIO;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RunJournalTest {

    @TempDir
    Path tmp;

    @Test
    void append_shouldRoundTripEventsInOrder() throws Exception {
        FileIO io = new FileIO(tmp);
        RunJournal journal = new RunJournal(io, new ObjectMapper(), io.resolve("runs.jsonl"));
        GenerationResult r = new GenerationResult(List.of("hi", "."), -0.5, null, Duration.ofMillis(12), 2, false, 1, List.of(1.0, 0.4));

        journal.append(RunEvent.of("SESSION_START", "s1", 1L));
        journal.append(RunEvent.completed("s1", "greet", r, 2L));
        journal.append(RunEvent.failed("s1", "bad", new IllegalStateException("nope"), 3L));

        List<RunEvent> all = journal.readAll();
        assertThat(all).extracting(e -> e.type).containsExactly("SESSION_START", "RUN", "RUN_FAILED");
        assertThat(all.get(1).bestSequence).isEqualTo("hi .");
        assertThat(all.get(1).steps).isEqualTo(2);
        assertThat(all.get(1).elapsedMs).isEqualTo(12L);
        assertThat(all.get(2).error).isEqualTo("IllegalStateException: nope");
    }

    @Test
    void completed_shouldOmitNonFiniteWeight() throws Exception {
        GenerationResult r = new GenerationResult(List.of("x"), Double.NEGATIVE_INFINITY, null, Duration.ZERO, 1, true, 0, List.of());

        String json = new ObjectMapper().writeValueAsString(RunEvent.completed("s", "q", r, 5L));

        assertThat(json).doesNotContain("bestLogWeight").contains("\"timedOut\":true");
    }
}
