package com.picfactory.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * All tunables of the orchestrator, bound from the {@code picfactory.*} keys.
 *
 * application.yml maps the environment variables the desktop launcher sets
 * (PICFACTORY_MOCK_RUNNER, PICFACTORY_ENABLE_REAL_RUNNER, ...) onto these keys.
 */
@ConfigurationProperties(prefix = "picfactory")
public class PicFactoryProperties {

    private Executor executor = new Executor();
    private Browser browser = new Browser();
    private Scheduler scheduler = new Scheduler();
    private Output output = new Output();

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    /**
     * Which task executor runs. {@code offline} wins over {@code live};
     * with neither set every task fails with a non-retryable "not enabled" reason.
     */
    public static class Executor {
        private boolean offline = false;
        private boolean live = false;
        private Duration offlineLatency = Duration.ofMillis(800);

        public boolean isOffline() {
            return offline;
        }

        public void setOffline(boolean offline) {
            this.offline = offline;
        }

        public boolean isLive() {
            return live;
        }

        public void setLive(boolean live) {
            this.live = live;
        }

        public Duration getOfflineLatency() {
            return offlineLatency;
        }

        public void setOfflineLatency(Duration offlineLatency) {
            this.offlineLatency = offlineLatency;
        }
    }

    public static class Browser {
        private String surfaceUrl = "https://chatgpt.com/";
        private boolean headless = false;
        private Path profileDir;
        private String channel;
        private Duration navigationTimeout = Duration.ofSeconds(45);
        private Duration actionTimeout = Duration.ofSeconds(15);
        private Duration generationTimeout = Duration.ofSeconds(240);
        private Duration loginWait = Duration.ofMinutes(5);

        public String getSurfaceUrl() {
            return surfaceUrl;
        }

        public void setSurfaceUrl(String surfaceUrl) {
            this.surfaceUrl = surfaceUrl;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public Path getProfileDir() {
            return profileDir;
        }

        public void setProfileDir(Path profileDir) {
            this.profileDir = profileDir;
        }

        /**
         * Persistent profile location; defaults to
         * {@code ~/.picfactory-runtime/playwright-profile}.
         */
        public Path resolveProfileDir() {
            if (profileDir != null && !profileDir.toString().isBlank()) {
                return profileDir;
            }
            return Path.of(System.getProperty("user.home"), ".picfactory-runtime", "playwright-profile");
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public Duration getNavigationTimeout() {
            return navigationTimeout;
        }

        public void setNavigationTimeout(Duration navigationTimeout) {
            this.navigationTimeout = navigationTimeout;
        }

        public Duration getActionTimeout() {
            return actionTimeout;
        }

        public void setActionTimeout(Duration actionTimeout) {
            this.actionTimeout = actionTimeout;
        }

        public Duration getGenerationTimeout() {
            return generationTimeout;
        }

        public void setGenerationTimeout(Duration generationTimeout) {
            this.generationTimeout = generationTimeout;
        }

        public Duration getLoginWait() {
            return loginWait;
        }

        public void setLoginWait(Duration loginWait) {
            this.loginWait = loginWait;
        }
    }

    public static class Scheduler {
        private int maxRetry = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration pausePoll = Duration.ofMillis(250);
        private Duration idlePoll = Duration.ofMillis(200);
        private Duration rateLimitTick = Duration.ofSeconds(1);

        public int getMaxRetry() {
            return maxRetry;
        }

        public void setMaxRetry(int maxRetry) {
            this.maxRetry = maxRetry;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public Duration getPausePoll() {
            return pausePoll;
        }

        public void setPausePoll(Duration pausePoll) {
            this.pausePoll = pausePoll;
        }

        public Duration getIdlePoll() {
            return idlePoll;
        }

        public void setIdlePoll(Duration idlePoll) {
            this.idlePoll = idlePoll;
        }

        public Duration getRateLimitTick() {
            return rateLimitTick;
        }

        public void setRateLimitTick(Duration rateLimitTick) {
            this.rateLimitTick = rateLimitTick;
        }
    }

    public static class Output {
        private Path defaultDir;

        public Path getDefaultDir() {
            return defaultDir;
        }

        public void setDefaultDir(Path defaultDir) {
            this.defaultDir = defaultDir;
        }
    }
}
