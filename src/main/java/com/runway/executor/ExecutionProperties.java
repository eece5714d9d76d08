package com.runway.executor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "runway")
public class ExecutionProperties {

    private Executor executor = new Executor();
    private Bridge bridge = new Bridge();
    private Temp temp = new Temp();

    // -- Executor accessors (delegate to nested) --
    public String getShell() { return executor.shell; }
    public String getAgentCommand() { return executor.agentCommand; }
    public Duration getHookTimeout() { return executor.hookTimeout; }
    public int getMaxOutputChars() { return executor.maxOutputChars; }

    /** Configured workspace root, or null when not set. */
    public Path getWorkspaceRoot() {
        String root = executor.workspaceRoot;
        return root == null || root.isBlank() ? null : Path.of(root);
    }

    // -- Bridge / temp accessors --
    public String getBridgePathPrefix() { return bridge.pathPrefix; }
    public int getBridgeThreads() { return bridge.threads; }

    public Path getTempDirectory() {
        String dir = temp.directory;
        return dir == null || dir.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"), "runway")
                : Path.of(dir);
    }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Bridge getBridge() { return bridge; }
    public void setBridge(Bridge bridge) { this.bridge = bridge; }
    public Temp getTemp() { return temp; }
    public void setTemp(Temp temp) { this.temp = temp; }

    public static class Executor {
        private String shell = "/bin/sh";
        private String workspaceRoot = "";
        private String agentCommand = "claude";
        private Duration hookTimeout = Duration.ofSeconds(30);
        private int maxOutputChars = 100_000;

        public String getShell() { return shell; }
        public void setShell(String shell) { this.shell = shell; }
        public String getWorkspaceRoot() { return workspaceRoot; }
        public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
        public String getAgentCommand() { return agentCommand; }
        public void setAgentCommand(String agentCommand) { this.agentCommand = agentCommand; }
        public Duration getHookTimeout() { return hookTimeout; }
        public void setHookTimeout(Duration hookTimeout) { this.hookTimeout = hookTimeout; }
        public int getMaxOutputChars() { return maxOutputChars; }
        public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    }

    public static class Bridge {
        private String pathPrefix = "/callback";
        private int threads = 4;

        public String getPathPrefix() { return pathPrefix; }
        public void setPathPrefix(String pathPrefix) { this.pathPrefix = pathPrefix; }
        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    public static class Temp {
        private String directory = "";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }
}
