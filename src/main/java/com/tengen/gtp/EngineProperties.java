package com.tengen.gtp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "tengen.engine")
public class EngineProperties {

    private List<String> command = new ArrayList<>(List.of("fuego"));
    private String workingDirectory = Path.of(System.getProperty("java.io.tmpdir"), "tengen").toString();
    private String stagingFileName = "tengen-load.sgf";
    private int logSize = 100;
    private boolean applyProfile = true;
    private Profile profile = new Profile();
    private Profile humanVsHumanProfile = Profile.withoutPondering();

    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    public String getStagingFileName() { return stagingFileName; }
    public void setStagingFileName(String stagingFileName) { this.stagingFileName = stagingFileName; }
    public int getLogSize() { return logSize; }
    public void setLogSize(int logSize) { this.logSize = logSize; }
    public boolean isApplyProfile() { return applyProfile; }
    public void setApplyProfile(boolean applyProfile) { this.applyProfile = applyProfile; }
    public Profile getProfile() { return profile; }
    public void setProfile(Profile profile) { this.profile = profile; }
    public Profile getHumanVsHumanProfile() { return humanVsHumanProfile; }
    public void setHumanVsHumanProfile(Profile humanVsHumanProfile) { this.humanVsHumanProfile = humanVsHumanProfile; }

    public Path workingDirectoryPath() {
        return Path.of(workingDirectory);
    }

    public static class Profile {
        private int maxMemoryMb = 32;
        private int threads = 1;
        private boolean pondering = true;
        private boolean reuseSubtree = true;
        private int maxPonderTimeSeconds = 300;
        private int maxThinkingTimeSeconds = 10;
        /** -1 for unlimited. */
        private long maxGames = -1L;

        static Profile withoutPondering() {
            var profile = new Profile();
            profile.pondering = false;
            return profile;
        }

        public int getMaxMemoryMb() { return maxMemoryMb; }
        public void setMaxMemoryMb(int maxMemoryMb) { this.maxMemoryMb = maxMemoryMb; }
        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
        public boolean isPondering() { return pondering; }
        public void setPondering(boolean pondering) { this.pondering = pondering; }
        public boolean isReuseSubtree() { return reuseSubtree; }
        public void setReuseSubtree(boolean reuseSubtree) { this.reuseSubtree = reuseSubtree; }
        public int getMaxPonderTimeSeconds() { return maxPonderTimeSeconds; }
        public void setMaxPonderTimeSeconds(int maxPonderTimeSeconds) { this.maxPonderTimeSeconds = maxPonderTimeSeconds; }
        public int getMaxThinkingTimeSeconds() { return maxThinkingTimeSeconds; }
        public void setMaxThinkingTimeSeconds(int maxThinkingTimeSeconds) { this.maxThinkingTimeSeconds = maxThinkingTimeSeconds; }
        public long getMaxGames() { return maxGames; }
        public void setMaxGames(long maxGames) { this.maxGames = maxGames; }

        public EngineProfile toEngineProfile() {
            return new EngineProfile(maxMemoryMb, threads, pondering, reuseSubtree,
                    maxPonderTimeSeconds, maxThinkingTimeSeconds, maxGames);
        }
    }
}
