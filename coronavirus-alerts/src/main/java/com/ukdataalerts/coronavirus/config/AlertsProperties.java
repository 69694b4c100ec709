package com.ukdataalerts.coronavirus.config;

import com.ukdataalerts.coronavirus.model.MetricCheck;
import com.ukdataalerts.coronavirus.model.Thresholds;
import com.ukdataalerts.coronavirus.model.VerificationMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "coronavirus-alerts")
@Data
public class AlertsProperties {

    private VerificationMode verificationMode = VerificationMode.UNVERIFIED;
    private ThresholdSettings thresholds = new ThresholdSettings();
    private List<MetricCheck> checks = new ArrayList<>();
    private Api api = new Api();
    private Populations populations = new Populations();
    private Baseline baseline = new Baseline();
    private Notify notify = new Notify();
    private Aws aws = new Aws();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class ThresholdSettings {
        private double percentageChange = 100.0;
        private double casesPer100000 = 100.0;
        private double hospitalAbsolute = 0.0;

        public Thresholds toThresholds() {
            return new Thresholds(percentageChange, casesPer100000, hospitalAbsolute);
        }
    }

    @Data
    public static class Api {
        private String seriesUrl = "https://api.coronavirus.data.gov.uk/v2/data";
        private String definitionsUrl = "https://coronavirus.data.gov.uk/public/assets/dispatch/api_variables.json";
        private String dashboardUrl = "https://coronavirus.data.gov.uk/";
        private int connectTimeoutSeconds = 30;
        private int readTimeoutSeconds = 300;
    }

    @Data
    public static class Populations {
        private Workbook ltla = new Workbook();
        private Workbook nhsRegion = new Workbook();
    }

    /**
     * Where a population table sits inside its spreadsheet. Rows and columns are zero-based
     * and columns are given as letters, e.g. "A".
     */
    @Data
    public static class Workbook {
        private String url;
        private String sheet;
        private int headerRow;
        private String keyColumn = "A";
        /** Summed to give the total population, e.g. Under 16 + 16+ */
        private List<String> valueColumns = new ArrayList<>();
        /** 0 reads until the first blank key */
        private int maxRows;
        /** Series area name to workbook key */
        private Map<String, String> aliases = new LinkedHashMap<>();
    }

    @Data
    public static class Baseline {
        private StorageMode storage = StorageMode.S3;
        private S3 s3 = new S3();
        private File file = new File();

        @Data
        public static class S3 {
            private String bucket = "investigations-data-dev";
            private String key = "uk-coronavirus-data-alerts/metrics.json";
        }

        @Data
        public static class File {
            private String path = "/data/baseline/metrics.json";
        }

        public enum StorageMode {
            S3, FILE
        }
    }

    @Data
    public static class Notify {
        /** Comma-separated; blank means log the alert instead of sending it */
        private String emailAddresses = "";
        private String sender = "investigations.and.reporting@theguardian.com";

        public List<String> recipients() {
            if (emailAddresses == null || emailAddresses.isBlank()) {
                return List.of();
            }
            return Arrays.stream(emailAddresses.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
    }

    @Data
    public static class Aws {
        private String region = "eu-west-1";
        /** Named local profile; blank uses the default credentials chain */
        private String profile = "";
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean enabled = false;
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 10 * * ?";
        private String zone = "Europe/London";
        private boolean runOnStartup = false;
    }
}
