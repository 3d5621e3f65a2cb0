package com.delta.archivescraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "archive-scraper/0.1 (+contact)";
    private static final String DEFAULT_BASE_URL = "https://api.pullpush.io/reddit/search";
    private static final String DEFAULT_ARCTIC_SHIFT_BASE_URL = "https://arctic-shift.photon-reddit.com/api";

    private String backend = "pullpush";
    private String baseUrl = DEFAULT_BASE_URL;
    private String arcticShiftBaseUrl = DEFAULT_ARCTIC_SHIFT_BASE_URL;
    private String timezone = "UTC";
    private String userAgent;
    private double sleepSec = 1.0;
    private double backoffSec = 3.0;
    private int maxRetries = 5;
    private int timeoutSeconds = 10;
    private String paceMode = "auto-hard";
    private int taskNum = 3;
    private Integer commentTaskNum;
    private String duplicateAction = "keep_newest";
    private int pageSize = 100;
    private String saveDir = ".";
    private RateLimit rateLimit = new RateLimit();
    private Cli cli = new Cli();

    public String getBaseUrl() {
        return baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getArcticShiftBaseUrl() {
        return arcticShiftBaseUrl == null || arcticShiftBaseUrl.isBlank()
            ? DEFAULT_ARCTIC_SHIFT_BASE_URL
            : arcticShiftBaseUrl.trim();
    }

    public void setArcticShiftBaseUrl(String arcticShiftBaseUrl) {
        this.arcticShiftBaseUrl = arcticShiftBaseUrl;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    /** Zone for date-times given without an offset; UTC when unset or unknown. */
    public ZoneId getZoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public double getSleepSec() {
        return Math.max(0.0, sleepSec);
    }

    public void setSleepSec(double sleepSec) {
        this.sleepSec = Math.max(0.0, sleepSec);
    }

    public double getBackoffSec() {
        return Math.max(0.0, backoffSec);
    }

    public void setBackoffSec(double backoffSec) {
        this.backoffSec = Math.max(0.0, backoffSec);
    }

    public int getMaxRetries() {
        return Math.max(1, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(1, maxRetries);
    }

    public int getTimeoutSeconds() {
        return Math.max(1, timeoutSeconds);
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    public String getPaceMode() {
        return paceMode;
    }

    public void setPaceMode(String paceMode) {
        this.paceMode = paceMode;
    }

    public int getTaskNum() {
        return Math.max(1, taskNum);
    }

    public void setTaskNum(int taskNum) {
        this.taskNum = Math.max(1, taskNum);
    }

    /**
     * Concurrency for the comment fan-out. Shares {@link #getTaskNum()} unless set.
     */
    public int getCommentTaskNum() {
        return commentTaskNum == null ? getTaskNum() : Math.max(1, commentTaskNum);
    }

    public void setCommentTaskNum(Integer commentTaskNum) {
        this.commentTaskNum = commentTaskNum;
    }

    public String getDuplicateAction() {
        return duplicateAction;
    }

    public void setDuplicateAction(String duplicateAction) {
        this.duplicateAction = duplicateAction;
    }

    public int getPageSize() {
        return Math.max(1, Math.min(100, pageSize));
    }

    public void setPageSize(int pageSize) {
        this.pageSize = Math.max(1, Math.min(100, pageSize));
    }

    public String getSaveDir() {
        return saveDir == null || saveDir.isBlank() ? "." : saveDir;
    }

    public void setSaveDir(String saveDir) {
        this.saveDir = saveDir;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
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

    /**
     * Local request pool and server quota tuning used by the auto pace modes.
     * Pool sizes follow the archive's published limits (15 soft, 30 hard per minute).
     */
    public static class RateLimit {
        private int maxPoolSoft = 15;
        private int maxPoolHard = 30;
        private long refillMs = 60_000;
        private int safetyMargin = 1;
        private double maxPaceSec = 60.0;
        private double cooldownSec = 5.0;

        public int getMaxPoolSoft() {
            return Math.max(1, maxPoolSoft);
        }

        public void setMaxPoolSoft(int maxPoolSoft) {
            this.maxPoolSoft = Math.max(1, maxPoolSoft);
        }

        public int getMaxPoolHard() {
            return Math.max(1, maxPoolHard);
        }

        public void setMaxPoolHard(int maxPoolHard) {
            this.maxPoolHard = Math.max(1, maxPoolHard);
        }

        public long getRefillMs() {
            return Math.max(1, refillMs);
        }

        public void setRefillMs(long refillMs) {
            this.refillMs = Math.max(1, refillMs);
        }

        public int getSafetyMargin() {
            return Math.max(0, safetyMargin);
        }

        public void setSafetyMargin(int safetyMargin) {
            this.safetyMargin = Math.max(0, safetyMargin);
        }

        public double getMaxPaceSec() {
            return Math.max(0.0, maxPaceSec);
        }

        public void setMaxPaceSec(double maxPaceSec) {
            this.maxPaceSec = Math.max(0.0, maxPaceSec);
        }

        public double getCooldownSec() {
            return Math.max(0.0, cooldownSec);
        }

        public void setCooldownSec(double cooldownSec) {
            this.cooldownSec = Math.max(0.0, cooldownSec);
        }
    }

    public static class Cli {
        private boolean run;
        private String backend;
        private String timezone;
        private String mode = "submissions";
        private String q;
        private String subreddit;
        private String author;
        private String linkId;
        private String after;
        private String before;
        private String sort = "desc";
        private String sortType = "created_utc";
        private Integer limit;
        private boolean getComments;
        private String fileName;
        private List<String> fields = List.of();
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getQ() {
            return q;
        }

        public void setQ(String q) {
            this.q = q;
        }

        public String getSubreddit() {
            return subreddit;
        }

        public void setSubreddit(String subreddit) {
            this.subreddit = subreddit;
        }

        public String getAuthor() {
            return author;
        }

        public void setAuthor(String author) {
            this.author = author;
        }

        public String getLinkId() {
            return linkId;
        }

        public void setLinkId(String linkId) {
            this.linkId = linkId;
        }

        public String getAfter() {
            return after;
        }

        public void setAfter(String after) {
            this.after = after;
        }

        public String getBefore() {
            return before;
        }

        public void setBefore(String before) {
            this.before = before;
        }

        public String getSort() {
            return sort;
        }

        public void setSort(String sort) {
            this.sort = sort;
        }

        public String getSortType() {
            return sortType;
        }

        public void setSortType(String sortType) {
            this.sortType = sortType;
        }

        public Integer getLimit() {
            return limit;
        }

        public void setLimit(Integer limit) {
            this.limit = limit;
        }

        public boolean isGetComments() {
            return getComments;
        }

        public void setGetComments(boolean getComments) {
            this.getComments = getComments;
        }

        public String getFileName() {
            return fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields == null ? List.of() : fields;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
