package net.scanorama.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("scanorama")
public class ScanoramaProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
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

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        /** Start the scheduler with the application context. */
        private boolean enabled = true;
        /** Threads that only compute trigger times and enqueue firings. */
        private int triggerPoolSize = 2;
        /** Threads running job bodies. */
        private int workerThreads = 4;
        /** Firings waiting for a worker; beyond this they are dropped. */
        private int queueCapacity = 100;
        private int scanBatchSize = 10;
        /** Parallel host scans inside one batch. */
        private int scanThreads = 10;
        private String defaultProfileId = "generic-default";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTriggerPoolSize() {
            return triggerPoolSize;
        }

        public void setTriggerPoolSize(int triggerPoolSize) {
            this.triggerPoolSize = triggerPoolSize;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getScanBatchSize() {
            return scanBatchSize;
        }

        public void setScanBatchSize(int scanBatchSize) {
            this.scanBatchSize = scanBatchSize;
        }

        public int getScanThreads() {
            return scanThreads;
        }

        public void setScanThreads(int scanThreads) {
            this.scanThreads = scanThreads;
        }

        public String getDefaultProfileId() {
            return defaultProfileId;
        }

        public void setDefaultProfileId(String defaultProfileId) {
            this.defaultProfileId = defaultProfileId;
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

    /** One job seeded from configuration. Discovery and scan fields share the definition, {@code type} picks. */
    public static class JobDef {
        private String name;
        private String type;
        private String cronExpr;
        private boolean enabled = true;

        // discovery
        private String network;
        private String method;
        private boolean detectOs;
        private int timeoutSeconds;
        private int concurrency;

        // scan
        private boolean liveHostsOnly;
        private List<String> networks = new ArrayList<>();
        private List<String> osFamilies = new ArrayList<>();
        private int maxAgeHours;
        private String profileId;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getCronExpr() {
            return cronExpr;
        }

        public void setCronExpr(String cronExpr) {
            this.cronExpr = cronExpr;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNetwork() {
            return network;
        }

        public void setNetwork(String network) {
            this.network = network;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public boolean isDetectOs() {
            return detectOs;
        }

        public void setDetectOs(boolean detectOs) {
            this.detectOs = detectOs;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public boolean isLiveHostsOnly() {
            return liveHostsOnly;
        }

        public void setLiveHostsOnly(boolean liveHostsOnly) {
            this.liveHostsOnly = liveHostsOnly;
        }

        public List<String> getNetworks() {
            return networks;
        }

        public void setNetworks(List<String> networks) {
            this.networks = networks;
        }

        public List<String> getOsFamilies() {
            return osFamilies;
        }

        public void setOsFamilies(List<String> osFamilies) {
            this.osFamilies = osFamilies;
        }

        public int getMaxAgeHours() {
            return maxAgeHours;
        }

        public void setMaxAgeHours(int maxAgeHours) {
            this.maxAgeHours = maxAgeHours;
        }

        public String getProfileId() {
            return profileId;
        }

        public void setProfileId(String profileId) {
            this.profileId = profileId;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", type='" + type + '\'' +
                    ", cronExpr='" + cronExpr + '\'' +
                    ", enabled=" + enabled +
                    '}';
        }
    }
}
