package org.calista.steer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.core.SteerComposer;
import org.calista.steer.core.SteerKernel;
import org.calista.steer.events.RunEvent;
import org.calista.steer.generate.GenerationException;
import org.calista.steer.generate.GenerationResult;
import org.calista.steer.generate.GenerationTask;
import org.calista.steer.generate.SteerLogFmt;
import org.calista.steer.generate.engine.SmcGenerationEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Scanner;

/**
 * SteerApp: interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config, IO, journal, JS context)
 *  2) compose the engine from config
 *  3) prompt loop: one guided generation per line, journaled
 *  4) close kernel
 */
public final class SteerApp {

    private static final Logger log = LogManager.getLogger(SteerApp.class);

    private final Path cfgPath;
    private SteerKernel kernel;
    private SteerComposer composer;
    private SmcGenerationEngine engine;

    public static void main(String[] args) throws Exception {
        Path cfg = args.length > 0 ? Path.of(args[0]) : Path.of("config/steer.json");
        new SteerApp(cfg).run();
    }

    public SteerApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public void run() throws IOException {
        try {
            kernel = SteerKernel.builder()
                    .configRoot(Path.of("."))
                    .enableJs(true)
                    .allowHostAccess(false)
                    .build(cfgPath);

            composer = new SteerComposer(kernel);
            engine = composer.buildEngine();

            runConsoleLoop();
        } finally {
            shutdown();
        }
    }

    private void runConsoleLoop() throws IOException {
        String sessionId = "sess-" + Long.toHexString(System.nanoTime());
        journal(RunEvent.of("SESSION_START", sessionId, System.currentTimeMillis()));

        log.info("Steer started. Type 'exit' to quit.");

        try (Scanner sc = new Scanner(System.in)) {
            while (true) {
                System.out.print("> ");
                if (!sc.hasNextLine()) break;
                String query = sc.nextLine().trim();
                if (query.equalsIgnoreCase("exit")) break;
                if (query.isEmpty()) continue;

                GenerationTask task = composer.taskFor(query);
                try {
                    GenerationResult r = engine.generate(task);
                    System.out.println("\n" + r.bestSequence() + "\n");
                    System.out.println("  steps=" + r.stepsCompleted() + " resamples=" + r.resampleCount()
                            + " logW=" + SteerLogFmt.num(r.bestLogWeight()) + " elapsedMs=" + r.elapsed().toMillis()
                            + (r.timedOut() ? " (timed out)" : "") + "\n");
                    journal(RunEvent.completed(sessionId, query, r, System.currentTimeMillis()));
                } catch (GenerationException e) {
                    log.warn("run.fail query='{}'", SteerLogFmt.clip(query, 60), e);
                    System.out.println("\n[no answer] " + e.getMessage() + "\n");
                    journal(RunEvent.failed(sessionId, query, e, System.currentTimeMillis()));
                }
            }
        }

        journal(RunEvent.of("SESSION_END", sessionId, System.currentTimeMillis()));
        System.out.println("Bye.");
    }

    private void journal(RunEvent e) throws IOException {
        if (kernel.config().journal.enabled) kernel.journal().append(e);
    }

    private void shutdown() {
        if (kernel != null) kernel.close();
    }
}
