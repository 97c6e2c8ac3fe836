/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.github.retouch.cli.CommandLine.ArgumentException;
import io.github.retouch.edit.EditEngine;
import io.github.retouch.edit.InvalidRegionException;
import io.github.retouch.image.TestImages;

class EditStepTest {

    @TempDir
    Path tmpDir;

    private EditEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        engine = new EditEngine();
        engine.load(TestImages.writePattern(tmpDir, "image.png", 100, 100));
    }

    @Test
    void cropStep() {
        assertThat(EditStep.parse("crop=60,60,10,10").applyTo(engine)).isTrue();

        assertThat(engine.current().width()).isEqualTo(50);
        assertThat(engine.current().height()).isEqualTo(50);
    }

    @Test
    void selectStep() {
        EditStep step = EditStep.parse("select=20,20,70,45@10,10,100,100");

        assertThat(step.applyTo(engine)).isTrue();

        assertThat(engine.current().width()).isEqualTo(50);
        assertThat(engine.current().height()).isEqualTo(25);
    }

    @Test
    void resizeStep() {
        assertThat(EditStep.parse("resize=37.5").applyTo(engine)).isTrue();

        assertThat(engine.current().width()).isEqualTo(38);
    }

    @Test
    void historySteps() {
        assertThat(EditStep.parse("undo").applyTo(engine)).as("undo").isFalse();

        EditStep.parse("GRAYSCALE").applyTo(engine);
        EditStep.parse("blur").applyTo(engine);

        assertThat(EditStep.parse("undo").applyTo(engine)).as("undo").isTrue();
        assertThat(EditStep.parse("redo").applyTo(engine)).as("redo").isTrue();
        assertThat(EditStep.parse("redo").applyTo(engine)).as("redo").isFalse();
        assertThat(EditStep.parse("reset").applyTo(engine)).as("reset").isTrue();
        assertThat(engine.canUndo()).isFalse();
    }

    @Test
    void engineFailurePropagates() {
        EditStep step = EditStep.parse("crop=200,200,300,300");

        assertThatThrownBy(() -> step.applyTo(engine))
                .isInstanceOf(InvalidRegionException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "sharpen",
        "crop",
        "crop=1,2,3",
        "crop=1,2,3,4.5",
        "crop=a,b,c,d",
        "resize=",
        "resize=NaN",
        "blur=3",
        "select=1,2,3,4",
        "select=1,2,3,4@0,0,10"
    })
    void malformedSteps(String arg) {
        assertThatThrownBy(() -> EditStep.parse(arg))
                .as(arg)
                .isInstanceOf(ArgumentException.class);
    }

    @Test
    void stepText() {
        assertThat(EditStep.parse("resize=50")).hasToString("resize=50");
    }

}
