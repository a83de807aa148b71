package de.bsommerfeld.dbkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    // Empty means <app-data>/dbkeeper.db
    @JsonProperty("path")
    private String path = "";

    @JsonProperty("apply-schema")
    private boolean applySchema = true;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public boolean isApplySchema() {
        return applySchema;
    }

    public void setApplySchema(boolean applySchema) {
        this.applySchema = applySchema;
    }
}
