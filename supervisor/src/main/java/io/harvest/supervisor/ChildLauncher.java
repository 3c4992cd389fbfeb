package io.harvest.supervisor;

import java.io.IOException;

/** Starts one instance of the supervised program, its stderr merged into stdout. */
@FunctionalInterface
public interface ChildLauncher {
    Process launch() throws IOException;
}
