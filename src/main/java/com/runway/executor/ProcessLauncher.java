package com.runway.executor;

import java.io.IOException;

/**
 * Starts operating-system processes. Visible processes are shown to the user;
 * hidden ones have their output piped back to the caller.
 */
public interface ProcessLauncher {

    Process start(ProcessSpec spec) throws IOException;
}
