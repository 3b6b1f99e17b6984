package com.operatorsedge.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "edge")
public class EdgeProperties {

    /** Project root; blank means resolve from the host environment. */
    private String projectDir = "";

    /** State directory; blank means {@code <project>/.claude/state}. */
    private String stateDir = "";

    /** Plan file; blank means {@code <project>/active_context.yaml}. */
    private String planFile = "";

    private Store store = new Store();
    private Loop loop = new Loop();
    private Junction junction = new Junction();
    private Patrol patrol = new Patrol();
    private Classifier classifier = new Classifier();

    public String getProjectDir() {
        return projectDir;
    }

    public void setProjectDir(String projectDir) {
        this.projectDir = projectDir;
    }

    public String getStateDir() {
        return stateDir;
    }

    public void setStateDir(String stateDir) {
        this.stateDir = stateDir;
    }

    public String getPlanFile() {
        return planFile;
    }

    public void setPlanFile(String planFile) {
        this.planFile = planFile;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Loop getLoop() {
        return loop;
    }

    public void setLoop(Loop loop) {
        this.loop = loop;
    }

    public Junction getJunction() {
        return junction;
    }

    public void setJunction(Junction junction) {
        this.junction = junction;
    }

    public Patrol getPatrol() {
        return patrol;
    }

    public void setPatrol(Patrol patrol) {
        this.patrol = patrol;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public static class Store {
        private long lockTimeoutMs = 3000;
        private long lockPollMs = 25;

        public long getLockTimeoutMs() {
            return lockTimeoutMs;
        }

        public void setLockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
        }

        public long getLockPollMs() {
            return lockPollMs;
        }

        public void setLockPollMs(long lockPollMs) {
            this.lockPollMs = lockPollMs;
        }
    }

    public static class Loop {
        private int maxIterations = 50;
        private int stuckThreshold = 3;

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public int getStuckThreshold() {
            return stuckThreshold;
        }

        public void setStuckThreshold(int stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
        }
    }

    public static class Junction {
        private int historyCap = 10;
        private int defaultSuppressMinutes = 60;

        public int getHistoryCap() {
            return historyCap;
        }

        public void setHistoryCap(int historyCap) {
            this.historyCap = historyCap;
        }

        public int getDefaultSuppressMinutes() {
            return defaultSuppressMinutes;
        }

        public void setDefaultSuppressMinutes(int defaultSuppressMinutes) {
            this.defaultSuppressMinutes = defaultSuppressMinutes;
        }
    }

    public static class Patrol {
        private int idlePassesBeforeDream = 3;
        private int maxFiles = 2000;
        private int maxFindings = 25;

        public int getIdlePassesBeforeDream() {
            return idlePassesBeforeDream;
        }

        public void setIdlePassesBeforeDream(int idlePassesBeforeDream) {
            this.idlePassesBeforeDream = idlePassesBeforeDream;
        }

        public int getMaxFiles() {
            return maxFiles;
        }

        public void setMaxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
        }

        public int getMaxFindings() {
            return maxFindings;
        }

        public void setMaxFindings(int maxFindings) {
            this.maxFindings = maxFindings;
        }
    }

    public static class Classifier {
        private List<String> safeControlCommands = List.of(
                "status", "help", "plan", "show", "list", "history",
                "junction", "gear", "health", "verify", "context");

        public List<String> getSafeControlCommands() {
            return safeControlCommands;
        }

        public void setSafeControlCommands(List<String> safeControlCommands) {
            this.safeControlCommands = safeControlCommands;
        }
    }
}
