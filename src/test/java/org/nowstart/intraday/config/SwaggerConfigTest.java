package org.nowstart.intraday.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.info.BuildProperties;

class SwaggerConfigTest {

    @Test
    void customOpenAPI_buildsExpectedMetadata() {
        Properties properties = new Properties();
        properties.setProperty("version", "0.1.0");
        SwaggerConfig config = new SwaggerConfig(new BuildProperties(properties));

        var openApi = config.customOpenAPI();

        assertThat(openApi.getInfo().getTitle()).isEqualTo("intraday strategy API");
        assertThat(openApi.getInfo().getDescription()).contains("Bar/tick event intake");
        assertThat(openApi.getInfo().getVersion()).isEqualTo("0.1.0");
    }
}
