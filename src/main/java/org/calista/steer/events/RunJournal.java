package org.calista.steer.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.steer.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Append-only JSONL journal of generation runs. */
public final class RunJournal {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public RunJournal(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public void append(RunEvent e) throws IOException {
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    public List<RunEvent> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        ArrayList<RunEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) out.add(mapper.readValue(line, RunEvent.class));
        return out;
    }

    public Path file() {
        return file;
    }
}
