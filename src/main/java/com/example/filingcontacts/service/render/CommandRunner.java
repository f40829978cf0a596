package com.example.filingcontacts.service.render;

import com.example.filingcontacts.dto.CommandResult;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program and reports its exit code and combined output.
 */
public interface CommandRunner {

    /**
     * @throws IOException if the program cannot be started or does not finish within {@code timeout}
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
