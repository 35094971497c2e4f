package net.cronhook.bootstrap.props;

import net.cronhook.core.schedule.ScheduleParser;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("cronhook")
public class CronhookProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Runner runner = new Runner();
    private Retention retention = new Retention();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Runner getRunner() {
        return runner;
    }

    public void setRunner(Runner runner) {
        this.runner = runner;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        /** 기동 시 저장된 활성 잡 타이머 등록 */
        private boolean initializeOnStartup = true;
        private int horizonYears = ScheduleParser.DEFAULT_HORIZON_YEARS;

        public boolean isInitializeOnStartup() {
            return initializeOnStartup;
        }

        public void setInitializeOnStartup(boolean initializeOnStartup) {
            this.initializeOnStartup = initializeOnStartup;
        }

        public int getHorizonYears() {
            return horizonYears;
        }

        public void setHorizonYears(int horizonYears) {
            this.horizonYears = horizonYears;
        }
    }

    public static class Runner {
        private Duration timeout = Duration.ofSeconds(30);
        /** 2xx 외 응답을 ERROR로 기록 */
        private boolean failOnHttpError = false;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isFailOnHttpError() {
            return failOnHttpError;
        }

        public void setFailOnHttpError(boolean failOnHttpError) {
            this.failOnHttpError = failOnHttpError;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private Duration maxAge = Duration.ofDays(30);
        private long initialDelayMs = 60_000;
        private long intervalMs = 3_600_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String id;
        private String url;
        private String schedule;
        private String body;
        private String secret;
        private boolean active = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getBody() {
            return body;
        }

        public void setBody(String body) {
            this.body = body;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "id='" + id + '\'' +
                    ", url='" + url + '\'' +
                    ", schedule='" + schedule + '\'' +
                    ", hasBody=" + (body != null) +
                    ", hasSecret=" + (secret != null) +
                    ", active=" + active +
                    '}';
        }
    }
}
