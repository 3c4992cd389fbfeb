package io.harvest.supervisor;

import java.io.IOException;
import java.util.List;

public class ProcessBuilderLauncher implements ChildLauncher {
    private final List<String> command;

    public ProcessBuilderLauncher(List<String> command) {
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("command must not be empty");
        this.command = List.copyOf(command);
    }

    @Override
    public Process launch() throws IOException {
        return new ProcessBuilder(command).redirectErrorStream(true).start();
    }
}
