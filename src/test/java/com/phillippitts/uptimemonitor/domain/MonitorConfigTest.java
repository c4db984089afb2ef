package com.phillippitts.uptimemonitor.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MonitorConfigTest {

    @Test
    void emptyConfigHasDefaults() {
        MonitorConfig config = MonitorConfig.empty();

        assertThat(config.httpMethod()).isEqualTo("GET");
        assertThat(config.statusCodes()).isEqualTo("200-299");
        assertThat(config.maxRedirects()).isEqualTo(10);
        assertThat(config.certExpiryDays()).isEqualTo(7);
        assertThat(config.packetCount()).isEqualTo(4);
        assertThat(config.maxPacketLoss()).isZero();
    }

    @Test
    void normalizesValues() {
        MonitorConfig config = MonitorConfig.builder()
                .httpMethod(" post ")
                .url("  https://example.test  ")
                .hostname("   ")
                .keyword("")
                .maxRedirects(-3)
                .maxPacketLoss(250)
                .packetCount(0)
                .build();

        assertThat(config.httpMethod()).isEqualTo("POST");
        assertThat(config.url()).isEqualTo("https://example.test");
        assertThat(config.hostname()).isNull();
        assertThat(config.keyword()).isNull();
        assertThat(config.maxRedirects()).isZero();
        assertThat(config.maxPacketLoss()).isEqualTo(100);
        assertThat(config.packetCount()).isEqualTo(4);
    }

    @Test
    void keywordWhitespaceIsSignificant() {
        assertThat(MonitorConfig.builder().keyword(" OK ").build().keyword()).isEqualTo(" OK ");
    }

    @Test
    void withoutSecretsDropsPasswordOnly() {
        MonitorConfig config = MonitorConfig.builder()
                .hostname("db").port(3306).username("monitor").password("s3cret").build();

        MonitorConfig redacted = config.withoutSecrets();

        assertThat(redacted.password()).isNull();
        assertThat(redacted.username()).isEqualTo("monitor");
        assertThat(redacted.port()).isEqualTo(3306);
    }

    @Test
    void toStringMasksSecrets() {
        MonitorConfig config = MonitorConfig.builder().password("s3cret").pushToken("tok123").build();

        assertThat(config.toString()).doesNotContain("s3cret").doesNotContain("tok123").contains("****");
    }
}
