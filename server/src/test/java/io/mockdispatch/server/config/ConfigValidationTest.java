package io.mockdispatch.server.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConfigValidationTest {

    @Test
    void defaultsAreValid() {
        assertThatCode(() -> ConfigLoader.validate(ServerConfig.builder().build())).doesNotThrowAnyException();
    }

    @Test
    void portZeroIsAllowed() {
        assertThatCode(() -> ConfigLoader.validate(ServerConfig.builder().port(0).build()))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 65536})
    void portOutOfRange(int port) {
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().port(port).build()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.port");
    }

    @Test
    void basePathMustNotBeRoot() {
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().basePath("/").build()))
                .hasMessageContaining("must not be the root path");
    }

    @Test
    void pathsMustBeAbsolute() {
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().basePath("v1").build()))
                .hasMessageContaining("server.base-path must start with '/'");
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().healthPath("health").build()))
                .hasMessageContaining("health.path");
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().adminReloadPath("reload").build()))
                .hasMessageContaining("admin.reload-path");
    }

    @Test
    void storeTypeIsChecked() {
        assertThatCode(() -> ConfigLoader.validate(ServerConfig.builder().storeType("FILE").build()))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().storeType("redis").build()))
                .hasMessageContaining("store.type must be 'memory' or 'file'");
    }

    @Test
    void limitsMustBePositive() {
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().conditionalMaxDepth(0).build()))
                .hasMessageContaining("conditional.max-depth must be positive");
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().queryDefaultLimit(-5).build()))
                .hasMessageContaining("query.default-limit must be positive");
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().maxBodyBytes(0).build()))
                .hasMessageContaining("server.max-body-bytes must be positive");
    }

    @Test
    void loggingFormatIsChecked() {
        assertThatThrownBy(() -> ConfigLoader.validate(ServerConfig.builder().loggingFormat("xml").build()))
                .hasMessageContaining("logging.format must be 'json' or 'text'");
    }
}
