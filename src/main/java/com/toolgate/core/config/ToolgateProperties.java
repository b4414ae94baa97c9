package com.toolgate.core.config;

import com.toolgate.core.mode.OperatingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "toolgate")
public class ToolgateProperties {

    private Mode mode = new Mode();
    private Policy policy = new Policy();
    private Approval approval = new Approval();
    private Grants grants = new Grants();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public Approval getApproval() {
        return approval;
    }

    public void setApproval(Approval approval) {
        this.approval = approval;
    }

    public Grants getGrants() {
        return grants;
    }

    public void setGrants(Grants grants) {
        this.grants = grants;
    }

    public static class Mode {
        private OperatingMode initial = OperatingMode.NORMAL;

        public OperatingMode getInitial() {
            return initial;
        }

        public void setInitial(OperatingMode initial) {
            this.initial = initial;
        }
    }

    public static class Policy {
        private String file = ".toolgate/tools.toml";
        private String defaultPermission = "ask";

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getDefaultPermission() {
            return defaultPermission;
        }

        public void setDefaultPermission(String defaultPermission) {
            this.defaultPermission = defaultPermission;
        }
    }

    public static class Approval {
        /** "console" for the terminal prompter, "http" for the REST approval queue. */
        private String channel = "console";
        private Duration timeout = Duration.ofMinutes(10);
        private Duration defaultDuration = Duration.ofMinutes(5);
        private int defaultIterations = 10;

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getDefaultDuration() {
            return defaultDuration;
        }

        public void setDefaultDuration(Duration defaultDuration) {
            this.defaultDuration = defaultDuration;
        }

        public int getDefaultIterations() {
            return defaultIterations;
        }

        public void setDefaultIterations(int defaultIterations) {
            this.defaultIterations = defaultIterations;
        }
    }

    public static class Grants {
        /** Give a consumed use back when the tool execution fails or is cancelled. */
        private boolean refundOnFailure = false;
        private long sweepIntervalMs = 60_000;

        public boolean isRefundOnFailure() {
            return refundOnFailure;
        }

        public void setRefundOnFailure(boolean refundOnFailure) {
            this.refundOnFailure = refundOnFailure;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }
}
