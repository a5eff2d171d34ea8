package fr.lapetina.ocr.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ocr.scheduler.domain.model.JobOptions;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;

/**
 * Body of {@code POST /v1/tasks}. Unset options fall back to configured defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmitTaskRequest {

    private String url;
    private Boolean bbox;
    private String language;

    @JsonProperty("pack_zip")
    private Boolean packZip;

    @JsonProperty("is_ocr")
    private Boolean ocr;

    @JsonProperty("enable_formula")
    private Boolean enableFormula;

    @JsonProperty("enable_table")
    private Boolean enableTable;

    @JsonProperty("page_ranges")
    private String pageRanges;

    @JsonProperty("model_version")
    private String modelVersion;

    // Getters and setters
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public Boolean getBbox() { return bbox; }
    public void setBbox(Boolean bbox) { this.bbox = bbox; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public Boolean getPackZip() { return packZip; }
    public void setPackZip(Boolean packZip) { this.packZip = packZip; }

    public Boolean getOcr() { return ocr; }
    public void setOcr(Boolean ocr) { this.ocr = ocr; }

    public Boolean getEnableFormula() { return enableFormula; }
    public void setEnableFormula(Boolean enableFormula) { this.enableFormula = enableFormula; }

    public Boolean getEnableTable() { return enableTable; }
    public void setEnableTable(Boolean enableTable) { this.enableTable = enableTable; }

    public String getPageRanges() { return pageRanges; }
    public void setPageRanges(String pageRanges) { this.pageRanges = pageRanges; }

    public String getModelVersion() { return modelVersion; }
    public void setModelVersion(String modelVersion) { this.modelVersion = modelVersion; }

    /**
     * Converts to domain JobOptions.
     */
    public JobOptions toJobOptions(SchedulerConfig.DefaultsConfig defaults) {
        return JobOptions.builder()
                .bbox(bbox != null ? bbox : defaults.isBbox())
                .packZip(packZip != null ? packZip : defaults.isPackZip())
                .ocr(ocr == null || ocr)
                .enableFormula(enableFormula == null || enableFormula)
                .enableTable(enableTable == null || enableTable)
                .language(language)
                .pageRanges(pageRanges)
                .modelVersion(modelVersion)
                .build();
    }
}
