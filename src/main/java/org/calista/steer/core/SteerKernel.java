package org.calista.steer.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.steer.events.RunJournal;
import org.calista.steer.io.FileIO;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * SteerKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> load or create config, open IO, journal and the JS context
 *   2) use               -> composer builds engines and tasks from it
 *   3) close()           -> release the JS context
 *
 * No static singletons.
 */
public final class SteerKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SteerKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final SteerConfig cfg;
    private final RunJournal journal;
    private final Context jsContext;

    private SteerKernel(FileIO io, ObjectMapper mapper, SteerConfig cfg, RunJournal journal, Context jsContext) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.jsContext = jsContext; // null when JS is disabled
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Directory the config file is resolved against; baseDir comes from the config itself. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;

        // GraalVM policy
        private boolean enableJs = true;
        private boolean allowHostAccess = false;
        private String warnInterpreterOnly = "false";

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder enableJs(boolean enableJs) {
            this.enableJs = enableJs;
            return this;
        }

        public Builder allowHostAccess(boolean allowHostAccess) {
            this.allowHostAccess = allowHostAccess;
            return this;
        }

        public Builder warnInterpreterOnly(String value) {
            this.warnInterpreterOnly = (value == null ? "false" : value);
            return this;
        }

        public SteerKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            SteerConfig cfg = SteerConfig.loadOrCreate(external, cfgPath, om);

            // a relative baseDir lives next to the config root
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, FileIO.Options.builder()
                    .charset(charset)
                    .atomicWrites(true)
                    .lockWrites(cfg.journal.lockWrites)
                    .lockTimeout(Duration.ofMillis(cfg.journal.lockTimeoutMs))
                    .build());

            RunJournal journal = new RunJournal(io, om, io.resolve(cfg.journal.logFile));
            Context js = enableJs ? buildJsContext(allowHostAccess, warnInterpreterOnly) : null;

            SteerKernel k = new SteerKernel(io, om, cfg, journal, js);
            log.info("SteerKernel created: config={}, baseDir={}, js={}", cfgPath, io.baseDir(), enableJs);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }

        private static Context buildJsContext(boolean allowHostAccess, String warnInterpreterOnly) {
            HostAccess ha = allowHostAccess ? HostAccess.ALL : HostAccess.NONE;
            return Context.newBuilder("js")
                    .allowHostAccess(ha)
                    .option("engine.WarnInterpreterOnly", warnInterpreterOnly == null ? "false" : warnInterpreterOnly)
                    .build();
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() {
        return io;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public SteerConfig config() {
        return cfg;
    }

    public RunJournal journal() {
        return journal;
    }

    public boolean jsEnabled() {
        return jsContext != null;
    }

    /** The shared JS context. Callers synchronize on it; a polyglot context admits one thread at a time. */
    public Context jsContext() {
        if (jsContext == null) throw new IllegalStateException("JS is disabled for this kernel");
        return jsContext;
    }

    @Override
    public void close() {
        if (jsContext == null) return;
        synchronized (jsContext) {
            jsContext.close(true);
        }
        log.debug("SteerKernel closed");
    }
}
