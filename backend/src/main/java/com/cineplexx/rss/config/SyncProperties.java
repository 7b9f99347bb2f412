package com.cineplexx.rss.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 cineplexx-rss";

    public enum DateMode {
        TODAY,
        FIXED
    }

    private String baseUrl = "https://cineplexx.me";
    private String location = "0";
    private DateMode dateMode = DateMode.TODAY;
    private String fixedDate = "";
    private String timezone = "Europe/Podgorica";
    private String outDir = "./out";
    private String userAgent;
    private int renderTimeoutSeconds = 60;
    private Feed feed = new Feed();
    private Cache cache = new Cache();
    private Fetch fetch = new Fetch();
    private Schedule schedule = new Schedule();
    private CatalogJob catalogJob = new CatalogJob();
    private ChannelJob channelJob = new ChannelJob();
    private Scheduler scheduler = new Scheduler();
    private Index index = new Index();
    private Cli cli = new Cli();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = stripTrailingSlash(baseUrl);
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location == null || location.isBlank() ? "0" : location.trim();
    }

    public DateMode getDateMode() {
        return dateMode;
    }

    public void setDateMode(DateMode dateMode) {
        this.dateMode = dateMode == null ? DateMode.TODAY : dateMode;
    }

    public String getFixedDate() {
        return fixedDate;
    }

    public void setFixedDate(String fixedDate) {
        this.fixedDate = fixedDate == null ? "" : fixedDate.trim();
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getOutDir() {
        return outDir;
    }

    public void setOutDir(String outDir) {
        this.outDir = outDir;
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRenderTimeoutSeconds() {
        return Math.max(1, renderTimeoutSeconds);
    }

    public void setRenderTimeoutSeconds(int renderTimeoutSeconds) {
        this.renderTimeoutSeconds = Math.max(1, renderTimeoutSeconds);
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public CatalogJob getCatalogJob() {
        return catalogJob;
    }

    public void setCatalogJob(CatalogJob catalogJob) {
        this.catalogJob = catalogJob;
    }

    public ChannelJob getChannelJob() {
        return channelJob;
    }

    public void setChannelJob(ChannelJob channelJob) {
        this.channelJob = channelJob;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static int positiveOrDefault(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    public static class Feed {
        private String title = "Cineplexx";
        private String link = "https://cineplexx.me";
        private String description = "Films currently showing";
        private String rssFilename = "cineplexx_rss.xml";
        private int eventsLimit = 150;
        private int maxEventsInState = 5000;

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getLink() {
            return link;
        }

        public void setLink(String link) {
            this.link = link;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getRssFilename() {
            return rssFilename;
        }

        public void setRssFilename(String rssFilename) {
            this.rssFilename = rssFilename;
        }

        public int getEventsLimit() {
            return Math.max(0, eventsLimit);
        }

        public void setEventsLimit(int eventsLimit) {
            this.eventsLimit = Math.max(0, eventsLimit);
        }

        public int getMaxEventsInState() {
            return positiveOrDefault(maxEventsInState, 5000);
        }

        public void setMaxEventsInState(int maxEventsInState) {
            this.maxEventsInState = positiveOrDefault(maxEventsInState, 5000);
        }
    }

    public static class Cache {
        private boolean enabled = false;
        private int descriptionTtlSeconds = 604800;
        private int descriptionNegativeTtlSeconds = 3600;
        private int scheduleTtlSeconds = 21600;
        private int scheduleNegativeTtlSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDescriptionTtlSeconds() {
            return positiveOrDefault(descriptionTtlSeconds, 604800);
        }

        public void setDescriptionTtlSeconds(int descriptionTtlSeconds) {
            this.descriptionTtlSeconds = positiveOrDefault(descriptionTtlSeconds, 604800);
        }

        public int getDescriptionNegativeTtlSeconds() {
            return positiveOrDefault(descriptionNegativeTtlSeconds, 3600);
        }

        public void setDescriptionNegativeTtlSeconds(int descriptionNegativeTtlSeconds) {
            this.descriptionNegativeTtlSeconds = positiveOrDefault(descriptionNegativeTtlSeconds, 3600);
        }

        public int getScheduleTtlSeconds() {
            return positiveOrDefault(scheduleTtlSeconds, 21600);
        }

        public void setScheduleTtlSeconds(int scheduleTtlSeconds) {
            this.scheduleTtlSeconds = positiveOrDefault(scheduleTtlSeconds, 21600);
        }

        public int getScheduleNegativeTtlSeconds() {
            return positiveOrDefault(scheduleNegativeTtlSeconds, 3600);
        }

        public void setScheduleNegativeTtlSeconds(int scheduleNegativeTtlSeconds) {
            this.scheduleNegativeTtlSeconds = positiveOrDefault(scheduleNegativeTtlSeconds, 3600);
        }
    }

    public static class Fetch {
        private int descriptionConcurrency = 4;
        private int scheduleConcurrency = 4;

        public int getDescriptionConcurrency() {
            return Math.max(1, descriptionConcurrency);
        }

        public void setDescriptionConcurrency(int descriptionConcurrency) {
            this.descriptionConcurrency = Math.max(1, descriptionConcurrency);
        }

        public int getScheduleConcurrency() {
            return Math.max(1, scheduleConcurrency);
        }

        public void setScheduleConcurrency(int scheduleConcurrency) {
            this.scheduleConcurrency = Math.max(1, scheduleConcurrency);
        }
    }

    public static class Schedule {
        private boolean enabled = true;
        private int maxDaysAhead = 14;
        private int maxSessionsPerMovie = 50;
        private int maxDatesPerMovie = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxDaysAhead() {
            return positiveOrDefault(maxDaysAhead, 14);
        }

        public void setMaxDaysAhead(int maxDaysAhead) {
            this.maxDaysAhead = positiveOrDefault(maxDaysAhead, 14);
        }

        public int getMaxSessionsPerMovie() {
            return positiveOrDefault(maxSessionsPerMovie, 50);
        }

        public void setMaxSessionsPerMovie(int maxSessionsPerMovie) {
            this.maxSessionsPerMovie = positiveOrDefault(maxSessionsPerMovie, 50);
        }

        public int getMaxDatesPerMovie() {
            return positiveOrDefault(maxDatesPerMovie, 10);
        }

        public void setMaxDatesPerMovie(int maxDatesPerMovie) {
            this.maxDatesPerMovie = positiveOrDefault(maxDatesPerMovie, 10);
        }
    }

    public static class CatalogJob {
        private boolean enabled = true;
        private int intervalSeconds = 21600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return Math.max(1, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(1, intervalSeconds);
        }
    }

    public static class ChannelJob {
        private boolean enabled = true;
        private int intervalSeconds = 1800;
        private List<String> channels = new ArrayList<>();
        private int postLimit = 5;
        private String baseUrl = "https://t.me";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return Math.max(1, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(1, intervalSeconds);
        }

        /** Channel names with {@code @} and {@code t.me/} prefixes removed, blanks and duplicates dropped. */
        public List<String> getChannels() {
            List<String> normalized = new ArrayList<>();
            for (String raw : channels) {
                String name = normalizeChannel(raw);
                if (name != null && !normalized.contains(name)) {
                    normalized.add(name);
                }
            }
            return normalized;
        }

        public void setChannels(List<String> channels) {
            this.channels = channels == null ? new ArrayList<>() : new ArrayList<>(channels);
        }

        public int getPostLimit() {
            return Math.max(1, postLimit);
        }

        public void setPostLimit(int postLimit) {
            this.postLimit = Math.max(1, postLimit);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = stripTrailingSlash(baseUrl);
        }

        static String normalizeChannel(String raw) {
            if (raw == null) {
                return null;
            }
            String name = raw.trim();
            String lower = name.toLowerCase(Locale.ROOT);
            for (String prefix : List.of("https://t.me/s/", "https://t.me/", "http://t.me/", "t.me/")) {
                if (lower.startsWith(prefix)) {
                    name = name.substring(prefix.length());
                    break;
                }
            }
            if (name.startsWith("@")) {
                name = name.substring(1);
            }
            name = stripTrailingSlash(name);
            return name.isBlank() ? null : name;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int idleSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIdleSeconds() {
            return Math.max(1, idleSeconds);
        }

        public void setIdleSeconds(int idleSeconds) {
            this.idleSeconds = Math.max(1, idleSeconds);
        }
    }

    public static class Index {
        private String siteTitle = "MyRssHub";
        private String filename = "index.xml";
        private String statusFilename = "status.json";

        public String getSiteTitle() {
            return siteTitle;
        }

        public void setSiteTitle(String siteTitle) {
            this.siteTitle = siteTitle;
        }

        public String getFilename() {
            return filename;
        }

        public void setFilename(String filename) {
            this.filename = filename;
        }

        public String getStatusFilename() {
            return statusFilename;
        }

        public void setStatusFilename(String statusFilename) {
            this.statusFilename = statusFilename;
        }
    }

    public static class Cli {
        private boolean runOnce;
        private boolean exitAfterRun = true;

        public boolean isRunOnce() {
            return runOnce;
        }

        public void setRunOnce(boolean runOnce) {
            this.runOnce = runOnce;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
