package com.example.filingcontacts.service.render;

import com.example.filingcontacts.dto.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        File log = File.createTempFile("cmd-", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(log);
            logger.debug("Running {}", String.join(" ", command));
            Process process = pb.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException(command.get(0) + " timed out after " + timeout.getSeconds() + "s");
            }
            String output = new String(Files.readAllBytes(log.toPath()), StandardCharsets.UTF_8);
            return new CommandResult(process.exitValue(), output);
        } finally {
            Files.deleteIfExists(log.toPath());
        }
    }
}
