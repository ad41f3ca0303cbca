package org.minilang.cli.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.minilang.compiler.AnalyzerSettings;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CliSettingsTest {

    @Test
    void readsEveryBlock() {
        CliSettings settings = CliSettings.fromConfig(ConfigFactory.parseString("""
                analyzer.max-source-length = 64
                cli.output-format = JSON
                logging.level = DEBUG
                """));

        assertThat(settings).isEqualTo(new CliSettings(new AnalyzerSettings(64), OutputFormat.JSON, "DEBUG"));
    }

    @Test
    void emptyConfigYieldsDefaults() {
        assertThat(CliSettings.fromConfig(ConfigFactory.empty())).isEqualTo(CliSettings.DEFAULT);
    }

    @Test
    void unknownOutputFormatIsRejected() {
        assertThatThrownBy(() -> CliSettings.fromConfig(ConfigFactory.parseString("cli.output-format = XML")))
                .isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    void explicitFormatWinsOverConfigured() {
        CliSettings settings = new CliSettings(AnalyzerSettings.DEFAULT, OutputFormat.JSON, "WARN");

        assertThat(settings.formatOr(OutputFormat.TEXT)).isEqualTo(OutputFormat.TEXT);
        assertThat(settings.formatOr(null)).isEqualTo(OutputFormat.JSON);
    }
}
