package fr.lapetina.ocr.scheduler.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Conversion options attached to a job.
 * Immutable and thread-safe.
 *
 * @param bbox          keep layout bounding boxes in the structured output
 * @param packZip       bundle the output directory into an archive
 * @param ocr           force OCR on image-only pages
 * @param enableFormula recognize formulas
 * @param enableTable   recognize tables
 * @param language      recognition language hint, defaults to {@code ch}
 * @param pageRanges    caller-restricted page selection such as {@code 1-3,5}, or null for all pages
 * @param modelVersion  target model variant, or null for the engine default
 */
public record JobOptions(
        @JsonProperty("bbox") boolean bbox,
        @JsonProperty("pack_zip") boolean packZip,
        @JsonProperty("is_ocr") boolean ocr,
        @JsonProperty("enable_formula") boolean enableFormula,
        @JsonProperty("enable_table") boolean enableTable,
        @JsonProperty("language") String language,
        @JsonProperty("page_ranges") String pageRanges,
        @JsonProperty("model_version") String modelVersion
) {
    public static final String DEFAULT_LANGUAGE = "ch";

    public JobOptions {
        if (language == null || language.isBlank()) {
            language = DEFAULT_LANGUAGE;
        }
        if (pageRanges != null && pageRanges.isBlank()) {
            pageRanges = null;
        }
        if (modelVersion != null && modelVersion.isBlank()) {
            modelVersion = null;
        }
    }

    public boolean hasPageRanges() {
        return pageRanges != null;
    }

    public static JobOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean bbox = true;
        private boolean packZip = true;
        private boolean ocr = true;
        private boolean enableFormula = true;
        private boolean enableTable = true;
        private String language = DEFAULT_LANGUAGE;
        private String pageRanges;
        private String modelVersion;

        public Builder bbox(boolean bbox) {
            this.bbox = bbox;
            return this;
        }

        public Builder packZip(boolean packZip) {
            this.packZip = packZip;
            return this;
        }

        public Builder ocr(boolean ocr) {
            this.ocr = ocr;
            return this;
        }

        public Builder enableFormula(boolean enableFormula) {
            this.enableFormula = enableFormula;
            return this;
        }

        public Builder enableTable(boolean enableTable) {
            this.enableTable = enableTable;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder pageRanges(String pageRanges) {
            this.pageRanges = pageRanges;
            return this;
        }

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public JobOptions build() {
            return new JobOptions(bbox, packZip, ocr, enableFormula, enableTable,
                    language, pageRanges, modelVersion);
        }
    }
}
