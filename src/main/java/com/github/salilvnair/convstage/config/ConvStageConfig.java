package com.github.salilvnair.convstage.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "convstage")
@Getter
@Setter
public class ConvStageConfig {

    private Store store = new Store();
    private Rules rules = new Rules();
    private DeviceRegistrySettings deviceRegistry = new DeviceRegistrySettings();
    private Columns columns = new Columns();

    @Getter
    @Setter
    public static class Store {
        /**
         * Transaction timeout applied to every rule store and device table call.
         */
        private int timeoutSeconds = 5;
    }

    @Getter
    @Setter
    public static class Rules {
        /**
         * If true, a rule can only be created for a device the registry currently lists.
         */
        private boolean requireKnownDevice = true;
    }

    @Getter
    @Setter
    public static class DeviceRegistrySettings {
        /**
         * db: read device_setting through JPA. http: call a remote registry.
         */
        private String mode = "db";
        private Http http = new Http();

        @Getter
        @Setter
        public static class Http {
            private String url;
            private int connectTimeoutMs = 2000;
            private int readTimeoutMs = 5000;
            private String devicesField = "devices";
            private String deviceIdField = "device_id";
            private Map<String, String> headers = new LinkedHashMap<>();
        }
    }

    @Getter
    @Setter
    public static class Columns {
        /**
         * Key: column label as configured on a rule.
         * Value: field name in the prospect record.
         * Seeded with the platform's built-in labels; configured entries are added on top.
         */
        private Map<String, String> aliases = defaultAliases();

        private static Map<String, String> defaultAliases() {
            Map<String, String> aliases = new LinkedHashMap<>();
            aliases.put("Nama", "prospect_name");
            aliases.put("Alamat", "alamat");
            aliases.put("Pakej", "pakej");
            aliases.put("No Fon", "no_fon");
            aliases.put("Tarikh Gaji", "tarikh_gaji");
            aliases.put("Cara Bayaran", "cara_bayaran");
            aliases.put("Peringkat Sekolah", "peringkat_sekolah");
            return aliases;
        }
    }
}
