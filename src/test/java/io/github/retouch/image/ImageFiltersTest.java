/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ImageFiltersTest {

    private final ImageBuffer source = ImageBuffer.of(TestImages.pattern(40, 30));

    @Test
    void grayscaleEqualizesChannels() {
        ImageBuffer gray = ImageFilters.grayscale(source);

        assertThat(gray.width()).isEqualTo(source.width());
        assertThat(gray.height()).isEqualTo(source.height());
        assertThat(gray.channels()).isEqualTo(3);
        for (int y = 0; y < gray.height(); y++) {
            for (int x = 0; x < gray.width(); x++) {
                int rgb = gray.rgb(x, y);
                assertThat(rgb >> 16 & 0xFF).as("(%d, %d)", x, y)
                        .isEqualTo(rgb >> 8 & 0xFF)
                        .isEqualTo(rgb & 0xFF);
            }
        }
    }

    @Test
    void blurIsDeterministic() {
        ImageBuffer first = ImageFilters.blur(source);
        ImageBuffer second = ImageFilters.blur(source);

        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(source);
        assertThat(first.width()).isEqualTo(source.width());
        assertThat(first.height()).isEqualTo(source.height());
    }

    @Test
    void blurSmoothsEdges() {
        ImageBuffer blurred = ImageFilters.blur(source);

        // The checker pattern alternates blue 32/224 every 4 pixels.
        int sharpStep = Math.abs((source.rgb(19, 15) & 0xFF) - (source.rgb(20, 15) & 0xFF));
        int blurredStep = Math.abs((blurred.rgb(19, 15) & 0xFF) - (blurred.rgb(20, 15) & 0xFF));
        assertThat(blurredStep).isLessThan(sharpStep);
    }

    @Test
    void blurKernelValidation() {
        assertThatThrownBy(() -> ImageFilters.blur(source, 4))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ImageFilters.blur(source, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resizeToSameSizeKeepsBuffer() {
        assertThat(ImageFilters.resize(source, 40, 30)).isSameAs(source);
    }

    @ParameterizedTest
    @CsvSource({
        "400, 200, 200, 100",
        "50, 100, 100, 200",
        "200, 200, 200, 200",
        "1000, 3, 200, 1"
    })
    void fitWithinPreviewBox(int width, int height, int expectedWidth, int expectedHeight) {
        ImageBuffer image = ImageBuffer.of(TestImages.solid(width, height, 0x808080));

        ImageBuffer preview = ImageFilters.fitWithin(image, 200);

        assertThat(preview.width()).as("width").isEqualTo(expectedWidth);
        assertThat(preview.height()).as("height").isEqualTo(expectedHeight);
    }

}
