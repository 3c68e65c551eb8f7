package org.calista.steer.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.steer.io.FileIO;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SteerConfigTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void loadOrCreate_shouldWriteDefaultsWhenMissing() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("conf/steer.json");

        SteerConfig cfg = SteerConfig.loadOrCreate(io, file, mapper);

        assertThat(Files.exists(file)).isTrue();
        assertThat(cfg.generation.particleCount).isEqualTo(16);
        assertThat(cfg.resampling.scheme).isEqualTo("SYSTEMATIC");
        assertThat(mapper.readTree(Files.readString(file)).path("generation").path("maxSteps").asInt()).isEqualTo(64);
    }

    @Test
    void loadOrCreate_shouldRecreateBlankFile() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("steer.json");
        Files.writeString(file, "  \n");

        SteerConfig cfg = SteerConfig.loadOrCreate(io, file, mapper);

        assertThat(cfg.generation.profile).isEqualTo("balanced");
        assertThat(Files.readString(file)).contains("\"particleCount\"");
    }

    @Test
    void loadOrCreate_shouldClampOutOfRangeValues() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("steer.json");
        Files.writeString(file, "{"
                + "\"generation\":{\"profile\":\"Turbo\",\"particleCount\":0,\"maxSteps\":-3,\"candidatesPerStep\":500,\"timeoutMs\":-1},"
                + "\"parallel\":{\"workers\":-2,\"batchSize\":-1,\"shutdownTimeoutMs\":5},"
                + "\"resampling\":{\"threshold\":2.5,\"scheme\":\"multinomial\"},"
                + "\"potentials\":{\"style\":\"formal\",\"maxLength\":3,\"minLength\":10,"
                + "\"scripts\":[{\"name\":\"\",\"scope\":\"incremental\",\"source\":\"function score(){return 1;}\"},{\"name\":\"empty\",\"source\":\" \"}]},"
                + "\"somethingNew\":true}");

        SteerConfig cfg = SteerConfig.loadOrCreate(io, file, mapper);

        assertThat(cfg.generation.profile).isEqualTo("balanced");
        assertThat(cfg.generation.particleCount).isEqualTo(1);
        assertThat(cfg.generation.maxSteps).isEqualTo(1);
        assertThat(cfg.generation.candidatesPerStep).isEqualTo(64);
        assertThat(cfg.generation.timeoutMs).isZero();
        assertThat(cfg.parallel.workers).isZero();
        assertThat(cfg.parallel.batchSize).isZero();
        assertThat(cfg.parallel.shutdownTimeoutMs).isEqualTo(100);
        assertThat(cfg.resampling.threshold).isEqualTo(1.0);
        assertThat(cfg.resampling.scheme).isEqualTo("MULTINOMIAL");
        assertThat(cfg.potentials.style).isEqualTo("FORMAL");
        assertThat(cfg.potentials.maxLength).isEqualTo(10);
        assertThat(cfg.potentials.scripts).hasSize(1);
        assertThat(cfg.potentials.scripts.get(0).name).isEqualTo("script-0");
        assertThat(cfg.potentials.scripts.get(0).scope).isEqualTo("INCREMENTAL");
    }

    @Test
    void validate_shouldRejectUnknownEnums() {
        SteerConfig cfg = new SteerConfig();
        cfg.resampling.scheme = "stochastic";
        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stochastic");

        SteerConfig other = new SteerConfig();
        other.output.selection = "first";
        assertThatThrownBy(other::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void save_shouldPersistEditedValues() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = tmp.resolve("steer.json");
        SteerConfig cfg = new SteerConfig();
        cfg.generation.seed = 42L;
        cfg.potentials.forbiddenTokens.add("bad");

        SteerConfig.save(io, file, mapper, cfg);
        SteerConfig back = SteerConfig.loadOrCreate(io, file, mapper);

        assertThat(back.generation.seed).isEqualTo(42L);
        assertThat(back.potentials.forbiddenTokens).containsExactly("bad");
    }
}
