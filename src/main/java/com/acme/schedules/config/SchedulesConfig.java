package com.acme.schedules.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Settings of the schedule store.
 */
@ConfigurationProperties("schedules")
public class SchedulesConfig {

    private boolean initSchema = false;
    private Search search = new Search();

    public boolean isInitSchema() {
        return initSchema;
    }

    public void setInitSchema(boolean initSchema) {
        this.initSchema = initSchema;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    @ConfigurationProperties("search")
    public static class Search {

        private int maxLimit = 1000;

        /** Upper bound applied to every search limit. */
        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }
}
