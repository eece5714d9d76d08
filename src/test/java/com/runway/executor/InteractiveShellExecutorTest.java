package com.runway.executor;

import com.runway.core.model.Command;
import com.runway.core.model.ExecutionMode;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;
import com.runway.core.remote.RemoteStoreProperties;
import com.runway.core.resources.TempResourceManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InteractiveShellExecutorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("runs visibly and reports only exit code and duration")
    void runsVisibly() throws Exception {
        var launcher = mock(ProcessLauncher.class);
        when(launcher.start(org.mockito.ArgumentMatchers.any()))
                .thenAnswer(inv -> new ProcessBuilder("/bin/sh", "-c", "echo ignored; exit 2").start());
        var executor = new InteractiveShellExecutor(launcher,
                new TempResourceManager(tempDir, new RemoteStoreProperties()), new ExecutionProperties(), null);
        var session = new Session("s-1", ExecutionMode.MANUAL, List.of(), null, null);

        var result = executor.execute("s-1", new Interaction("i-1", Command.of("make test"), null), session)
                .get(10, TimeUnit.SECONDS);

        assertEquals(2, result.exitCode());
        assertEquals("", result.stdout());

        var captor = ArgumentCaptor.forClass(ProcessSpec.class);
        verify(launcher).start(captor.capture());
        assertTrue(captor.getValue().visible());
        assertEquals(List.of("/bin/sh", "-c", "make test"), captor.getValue().command());
    }
}
