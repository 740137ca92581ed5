package com.switchyard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "switchyard")
public class SwitchyardProperties {

    private String repositoryPath = ".";
    private String branchPrefix = "switchyard";
    private String worktreeDir = ".switchyard/worktrees";
    private String defaultParentBranch = "main";
    private String databasePath = System.getProperty("user.home") + "/.switchyard/switchyard.db";
    private Stats stats = new Stats();
    private Launch launch = new Launch();
    private Merge merge = new Merge();
    private Map<String, Agent> agents = new LinkedHashMap<>();

    // -- Derived accessors --
    public Path getRepositoryRoot() { return Path.of(repositoryPath).toAbsolutePath().normalize(); }
    public Duration getStatsMaxAge() { return Duration.ofSeconds(stats.maxAgeSeconds); }
    public Duration getLaunchTimeout() { return Duration.ofSeconds(launch.timeoutSeconds); }
    public Duration getTerminateGrace() { return Duration.ofMillis(launch.terminateGraceMillis); }
    public Duration getMergeTimeout() { return Duration.ofSeconds(merge.timeoutSeconds); }

    public String getRepositoryPath() { return repositoryPath; }
    public void setRepositoryPath(String repositoryPath) { this.repositoryPath = repositoryPath; }
    public String getBranchPrefix() { return branchPrefix; }
    public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
    public String getWorktreeDir() { return worktreeDir; }
    public void setWorktreeDir(String worktreeDir) { this.worktreeDir = worktreeDir; }
    public String getDefaultParentBranch() { return defaultParentBranch; }
    public void setDefaultParentBranch(String defaultParentBranch) { this.defaultParentBranch = defaultParentBranch; }
    public String getDatabasePath() { return databasePath; }
    public void setDatabasePath(String databasePath) { this.databasePath = databasePath; }
    public Stats getStats() { return stats; }
    public void setStats(Stats stats) { this.stats = stats; }
    public Launch getLaunch() { return launch; }
    public void setLaunch(Launch launch) { this.launch = launch; }
    public Merge getMerge() { return merge; }
    public void setMerge(Merge merge) { this.merge = merge; }
    public Map<String, Agent> getAgents() { return agents; }
    public void setAgents(Map<String, Agent> agents) { this.agents = agents; }

    public static class Stats {
        private long maxAgeSeconds = 60;

        public long getMaxAgeSeconds() { return maxAgeSeconds; }
        public void setMaxAgeSeconds(long maxAgeSeconds) { this.maxAgeSeconds = maxAgeSeconds; }
    }

    public static class Launch {
        private long timeoutSeconds = 12;
        private long terminateGraceMillis = 1500;

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public long getTerminateGraceMillis() { return terminateGraceMillis; }
        public void setTerminateGraceMillis(long terminateGraceMillis) { this.terminateGraceMillis = terminateGraceMillis; }
    }

    public static class Merge {
        private long timeoutSeconds = 180;

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    /**
     * Per-agent overrides. Unset fields fall back to the built-in manifest.
     */
    public static class Agent {
        private String binary;
        private Map<String, String> env = new LinkedHashMap<>();
        private List<String> extraArgs = new ArrayList<>();

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
        public List<String> getExtraArgs() { return extraArgs; }
        public void setExtraArgs(List<String> extraArgs) { this.extraArgs = extraArgs; }
    }
}
