package org.learningjava.embbench.infrastructure.adapter.in.cli;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/** Exit status of the command that ran, picked up by {@code SpringApplication.exit}. */
@Component
public class CliExitCode implements ExitCodeGenerator {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int USAGE = 2;

    private volatile int code = OK;

    public void set(int code) { this.code = code; }

    @Override
    public int getExitCode() { return code; }
}
