/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.FieldSource;

import io.github.retouch.image.ImageBuffer;
import io.github.retouch.image.ImageFilters;
import io.github.retouch.image.Region;
import io.github.retouch.image.TestImages;

class EditEngineTest {

    @TempDir
    Path tmpDir;

    private Path image100;

    private EditEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        image100 = TestImages.writePattern(tmpDir, "image100.png", 100, 100);
        engine = new EditEngine();
    }

    static final List<Consumer<EditEngine>> mutations = List.of(
            e -> e.crop(Region.of(10, 10, 60, 60)),
            e -> e.resize(50),
            e -> e.grayscale(),
            e -> e.blur(),
            e -> e.crop(new Point2D.Double(20, 20), new Point2D.Double(70, 70),
                        new Rectangle2D.Double(10, 10, 100, 100)));

    @Test
    void loadInitializesSession() throws Exception {
        ImageBuffer loaded = engine.load(image100);

        assertThat(engine.isLoaded()).isTrue();
        assertThat(engine.current()).isEqualTo(loaded);
        assertThat(engine.original()).isEqualTo(loaded);
        assertThat(engine.resizeBase()).isEqualTo(loaded);
        assertThat(engine.canUndo()).isFalse();
        assertThat(engine.canRedo()).isFalse();
        assertThat(engine.source()).contains(image100);
    }

    @Test
    void loadReplacesSession() throws Exception {
        engine.load(image100);
        engine.grayscale();
        engine.undo();
        Path other = TestImages.writePattern(tmpDir, "other.png", 30, 20);

        engine.load(other);

        assertThat(engine.current().width()).isEqualTo(30);
        assertThat(engine.original()).isEqualTo(engine.current());
        assertThat(engine.undoDepth()).isZero();
        assertThat(engine.redoDepth()).isZero();
    }

    @Test
    void emptyEngine() {
        assertThat(engine.isLoaded()).isFalse();
        assertThat(engine.undo()).as("undo").isFalse();
        assertThat(engine.redo()).as("redo").isFalse();
        assertThat(engine.reset()).as("reset").isFalse();
        assertThatThrownBy(() -> engine.current())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> engine.grayscale())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> engine.resize(50))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> engine.save(tmpDir.resolve("out.png")))
                .isInstanceOf(ImageSaveException.class)
                .hasMessage("No image to save");
    }

    @ParameterizedTest
    @FieldSource("mutations")
    void undoAndRedoSingleMutation(Consumer<EditEngine> mutation) throws Exception {
        engine.load(image100);
        ImageBuffer before = engine.current();

        mutation.accept(engine);
        ImageBuffer after = engine.current();

        assertThat(engine.undoDepth()).as("undo depth").isEqualTo(1);
        assertThat(engine.undo()).as("undo").isTrue();
        assertThat(engine.current()).as("after undo").isEqualTo(before);
        assertThat(engine.resizeBase()).as("resize base after undo").isEqualTo(before);
        assertThat(engine.redo()).as("redo").isTrue();
        assertThat(engine.current()).as("after redo").isEqualTo(after);
        assertThat(engine.resizeBase()).as("resize base after redo").isEqualTo(after);
    }

    @ParameterizedTest
    @FieldSource("mutations")
    void mutationAfterUndoClearsRedo(Consumer<EditEngine> mutation) throws Exception {
        engine.load(image100);
        engine.grayscale();
        engine.undo();
        assertThat(engine.canRedo()).isTrue();

        mutation.accept(engine);

        assertThat(engine.canRedo()).isFalse();
        assertThat(engine.redo()).isFalse();
    }

    @Test
    void historyIsBounded() throws Exception {
        engine.load(image100);
        for (int i = 0; i < 21; i++) {
            if (i % 2 == 0) {
                engine.blur();
            } else {
                engine.resize(100 - i);
            }
        }

        assertThat(engine.undoDepth()).isEqualTo(20);
        int undone = 0;
        while (engine.undo()) {
            undone++;
        }
        assertThat(undone).isEqualTo(20);
        assertThat(engine.undo()).isFalse();
    }

    @Test
    void historyLimitFromSettings() throws Exception {
        engine = new EditEngine(EditSettings.defaults().withHistoryLimit(3));
        engine.load(image100);
        engine.grayscale();
        engine.blur();
        engine.blur();
        engine.blur();

        assertThat(engine.undoDepth()).isEqualTo(3);
    }

    @Test
    void cropOrderIndependent() throws Exception {
        engine.load(image100);
        engine.crop(Region.of(60, 60, 10, 10));
        ImageBuffer inverted = engine.current();

        engine.reset();
        engine.crop(Region.of(10, 10, 60, 60));

        assertThat(engine.current()).isEqualTo(inverted);
    }

    @Test
    void cropClampsToImage() throws Exception {
        ImageBuffer loaded = engine.load(image100);

        engine.crop(Region.of(-20, 50, 40, 150));

        assertThat(engine.current()).isEqualTo(loaded.subImage(Region.of(0, 50, 40, 100)));
        assertThat(engine.resizeBase()).isEqualTo(engine.current());
    }

    @Test
    void cropToZeroAreaFails() throws Exception {
        ImageBuffer loaded = engine.load(image100);

        assertThatThrownBy(() -> engine.crop(Region.of(120, 120, 300, 300)))
                .isInstanceOf(InvalidRegionException.class);
        assertThatThrownBy(() -> engine.crop(Region.of(30, 10, 30, 60)))
                .isInstanceOf(InvalidRegionException.class);
        assertThatThrownBy(() -> engine.crop(new Point2D.Double(0, 0),
                new Point2D.Double(5, 5), new Rectangle2D.Double(10, 10, 100, 100)))
                .isInstanceOf(InvalidRegionException.class);

        assertThat(engine.current()).isEqualTo(loaded);
        assertThat(engine.canUndo()).isFalse();
    }

    @Test
    void resizeDerivesFromResizeBase() throws Exception {
        Path image50 = TestImages.writePattern(tmpDir, "image50.png", 50, 50);
        ImageBuffer loaded = engine.load(image50);

        engine.resize(50);
        assertThat(engine.current().width()).isEqualTo(25);
        assertThat(engine.current().height()).isEqualTo(25);

        engine.resize(200);
        assertThat(engine.current().width()).isEqualTo(100);
        assertThat(engine.current().height()).isEqualTo(100);
        assertThat(engine.current())
                .isEqualTo(ImageFilters.resize(loaded, 100, 100));
        assertThat(engine.resizeBase()).isEqualTo(loaded);
    }

    @Test
    void resizeRounds() throws Exception {
        engine.load(TestImages.writePattern(tmpDir, "odd.png", 33, 7));

        engine.resize(50);

        assertThat(engine.current().width()).isEqualTo(17);
        assertThat(engine.current().height()).isEqualTo(4);
    }

    @Test
    void degenerateResizeFails() throws Exception {
        ImageBuffer loaded = engine.load(image100);

        assertThatThrownBy(() -> engine.resize(0.4))
                .isInstanceOf(DegenerateSizeException.class);
        assertThatThrownBy(() -> engine.resize(0))
                .isInstanceOf(DegenerateSizeException.class);
        assertThatThrownBy(() -> engine.resize(-50))
                .isInstanceOf(DegenerateSizeException.class);
        assertThatThrownBy(() -> engine.resize(Double.NaN))
                .isInstanceOf(DegenerateSizeException.class);

        assertThat(engine.current()).isEqualTo(loaded);
        assertThat(engine.canUndo()).isFalse();
    }

    @Test
    void oversizedResizeKeepsHistory() throws Exception {
        Path pixel = TestImages.writePattern(tmpDir, "pixel.png", 1, 1);
        ImageBuffer loaded = engine.load(pixel);
        engine.grayscale();
        engine.undo();

        assertThatThrownBy(() -> engine.resize(214748364700.0))
                .isInstanceOf(DegenerateSizeException.class);
        // Each side fits an int while the sample count overflows a long product.
        assertThatThrownBy(() -> engine.resize(200_000_000_000.0))
                .isInstanceOf(DegenerateSizeException.class);

        assertThat(engine.current()).isEqualTo(loaded);
        assertThat(engine.undoDepth()).as("undo depth").isZero();
        assertThat(engine.redoDepth()).as("redo depth").isEqualTo(1);
        assertThat(engine.redo()).isTrue();
    }

    @Test
    void effectsResetResizeBase() throws Exception {
        engine.load(image100);
        engine.resize(50);
        engine.grayscale();

        assertThat(engine.resizeBase()).isEqualTo(engine.current());
        assertThat(engine.resizeBase().width()).isEqualTo(50);

        engine.blur();
        assertThat(engine.resizeBase()).isEqualTo(engine.current());
    }

    @Test
    void resetRestoresOriginal() throws Exception {
        ImageBuffer loaded = engine.load(image100);
        engine.crop(Region.of(0, 0, 40, 40));
        engine.blur();
        engine.undo();

        assertThat(engine.reset()).isTrue();

        assertThat(engine.current()).isEqualTo(loaded);
        assertThat(engine.resizeBase()).isEqualTo(loaded);
        assertThat(engine.original()).isEqualTo(loaded);
        assertThat(engine.canUndo()).isFalse();
        assertThat(engine.canRedo()).isFalse();
    }

    @Test
    void originalSurvivesEdits() throws Exception {
        ImageBuffer loaded = engine.load(image100);
        engine.grayscale();
        engine.crop(Region.of(5, 5, 50, 50));
        engine.resize(150);

        assertThat(engine.original()).isEqualTo(loaded);
    }

    @Test
    void cropResizeUndoRedoScenario() throws Exception {
        ImageBuffer loaded = engine.load(image100);

        engine.crop(Region.of(10, 10, 60, 60));
        ImageBuffer cropped = engine.current();
        assertThat(cropped.width()).isEqualTo(50);
        assertThat(cropped.height()).isEqualTo(50);
        assertThat(engine.resizeBase()).isEqualTo(cropped);

        engine.resize(200);
        ImageBuffer resized = engine.current();
        assertThat(resized.width()).isEqualTo(100);
        assertThat(resized.height()).isEqualTo(100);
        assertThat(resized).isEqualTo(ImageFilters.resize(cropped, 100, 100));

        assertThat(engine.undo()).isTrue();
        assertThat(engine.current()).isEqualTo(cropped);
        assertThat(engine.undo()).isTrue();
        assertThat(engine.current()).isEqualTo(loaded);

        assertThat(engine.redo()).isTrue();
        assertThat(engine.current()).isEqualTo(cropped);
        assertThat(engine.redo()).isTrue();
        assertThat(engine.current()).isEqualTo(resized);
        assertThat(engine.redo()).isFalse();
    }

    @Test
    void failedLoadKeepsSession() throws Exception {
        ImageBuffer loaded = engine.load(image100);
        engine.grayscale();
        ImageBuffer edited = engine.current();
        Path text = Files.writeString(tmpDir.resolve("notes.png"), "not an image");

        assertThatThrownBy(() -> engine.load(text))
                .isInstanceOf(ImageLoadException.class);
        assertThatThrownBy(() -> engine.load(tmpDir.resolve("missing.png")))
                .isInstanceOf(ImageLoadException.class)
                .hasMessageStartingWith("File not found");

        assertThat(engine.current()).isEqualTo(edited);
        assertThat(engine.original()).isEqualTo(loaded);
        assertThat(engine.undoDepth()).isEqualTo(1);
        assertThat(engine.source()).contains(image100);
    }

    @Test
    void failedLoadOnEmptyEngine() {
        assertThatThrownBy(() -> engine.load(tmpDir.resolve("missing.png")))
                .isInstanceOf(ImageLoadException.class);

        assertThat(engine.isLoaded()).isFalse();
        assertThat(engine.source()).isEmpty();
    }

    @Test
    void saveAndReloadPNG() throws Exception {
        engine.load(image100);
        engine.crop(Region.of(0, 0, 64, 32));
        Path output = tmpDir.resolve("cropped.PNG");

        engine.save(output);

        ImageBuffer saved = new EditEngine().load(output);
        assertThat(saved).isEqualTo(engine.current());
        assertThat(engine.undoDepth()).isEqualTo(1);
    }

    @Test
    void failedSaveKeepsSession() throws Exception {
        engine.load(image100);
        engine.grayscale();
        engine.crop(Region.of(0, 0, 50, 50));
        engine.undo();
        ImageBuffer current = engine.current();

        assertThatThrownBy(() -> engine.save(tmpDir.resolve("out.unknown")))
                .isInstanceOf(ImageSaveException.class);
        assertThatThrownBy(() -> engine.save(tmpDir.resolve("missing/out.png")))
                .isInstanceOf(ImageSaveException.class);

        assertThat(engine.current()).isEqualTo(current);
        assertThat(engine.resizeBase()).isEqualTo(current);
        assertThat(engine.undoDepth()).as("undo depth").isEqualTo(1);
        assertThat(engine.redoDepth()).as("redo depth").isEqualTo(1);
    }

}
