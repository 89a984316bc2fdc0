package org.calista.parrot.ai;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.parrot.ai.core.ParrotKernel;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * ParrotApp: interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config + dictionary, no bootstrap inside build)
 *  2) kernel.bootstrap()
 *  3) run loop: respond, then learn
 *  4) close kernel (saves dictionary)
 */
public final class ParrotApp {

    private static final Logger log = LogManager.getLogger(ParrotApp.class);

    private final Path configRoot;
    private final Path cfgPath;
    private ParrotKernel kernel;

    public static void main(String[] args) throws Exception {
        Path cfg = (args.length > 0) ? Path.of(args[0]) : Path.of("config/config.json");
        new ParrotApp(Path.of("."), cfg).run(System.in, System.out);
    }

    /**
     * @param configRoot directory that relative config and data paths are resolved against
     */
    public ParrotApp(Path configRoot, Path cfgPath) {
        this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
        this.cfgPath = Objects.requireNonNull(cfgPath, "cfgPath");
    }

    public void run(InputStream in, PrintStream out) throws IOException {
        kernel = ParrotKernel.builder()
                .configRoot(configRoot)
                .build(cfgPath);
        try {
            kernel.bootstrap();
            runConsoleLoop(in, out);
        } finally {
            kernel.close();
        }
    }

    private void runConsoleLoop(InputStream in, PrintStream out) throws IOException {
        long turns = 0;
        int every = kernel.config().dictionary.autoSaveEveryTurns;

        log.info("Parrot started. sentences={}, words={}",
                kernel.dictionary().size(), kernel.dictionary().wordCount());

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print("> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) break;

            line = line.trim();
            if (line.equalsIgnoreCase("exit")) break;
            if (line.isEmpty()) continue;

            // answer from what is known before this line, then learn it
            Optional<String> reply = kernel.respondTo(line);
            reply.ifPresent(out::println);

            if (kernel.learn(line)) {
                log.debug("Learned from turn {}: sentences={}", turns + 1, kernel.dictionary().size());
            }

            turns++;
            if (turns % every == 0) {
                kernel.save();
                log.debug("Auto-saved dictionary after {} turns", turns);
            }
        }

        out.println("Bye.");
    }

    public ParrotKernel getKernel() { return kernel; }

    public Path getCfgPath() { return cfgPath; }
}
