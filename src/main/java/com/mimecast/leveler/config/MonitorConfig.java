package com.mimecast.leveler.config;

import java.util.Map;

/**
 * Queue health monitor configuration.
 */
public class MonitorConfig extends BasicConfig {

    /**
     * Constructs a new MonitorConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public MonitorConfig(Map map) {
        super(map);
    }

    public long getDeadLetterWarningThreshold() {
        return getLongProperty("deadLetterWarningThreshold", 100L);
    }

    public long getBacklogWarningThreshold() {
        return getLongProperty("backlogWarningThreshold", 1000L);
    }

    /**
     * Gets how many recent alerts are retained.
     *
     * @return Alert count.
     */
    public int getMaxRecentAlerts() {
        return Math.toIntExact(getLongProperty("maxRecentAlerts", 100L));
    }
}
