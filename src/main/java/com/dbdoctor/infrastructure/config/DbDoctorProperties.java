package com.dbdoctor.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "dbdoctor")
public class DbDoctorProperties {

    private String mode = "interactive";
    private String catalogLocation = "classpath:schema-catalog.json";
    private Tables tables = new Tables();
    private Query query = new Query();
    private Pool pool = new Pool();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getCatalogLocation() {
        return catalogLocation;
    }

    public void setCatalogLocation(String catalogLocation) {
        this.catalogLocation = catalogLocation;
    }

    public Tables getTables() {
        return tables;
    }

    public void setTables(Tables tables) {
        this.tables = tables;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    /**
     * Names of the tables some checks treat specially.
     */
    public static class Tables {
        private String pages = "pages";
        private String workspace = "sys_workspace";
        private String fileReference = "sys_file_reference";

        public String getPages() {
            return pages;
        }

        public void setPages(String pages) {
            this.pages = pages;
        }

        public String getWorkspace() {
            return workspace;
        }

        public void setWorkspace(String workspace) {
            this.workspace = workspace;
        }

        public String getFileReference() {
            return fileReference;
        }

        public void setFileReference(String fileReference) {
            this.fileReference = fileReference;
        }
    }

    public static class Query {
        private int fetchSize = 500;
        private int chunkSize = 1000;

        public int getFetchSize() {
            return fetchSize;
        }

        public void setFetchSize(int fetchSize) {
            this.fetchSize = fetchSize;
        }

        /**
         * Maximum number of uids bound into a single IN list.
         */
        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }
    }

    public static class Pool {
        private int maxPoolSize = 2;
        private int minIdle = 1;

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getMinIdle() {
            return minIdle;
        }

        public void setMinIdle(int minIdle) {
            this.minIdle = minIdle;
        }
    }
}
