package com.project.agro.analysis;

import com.project.agro.analysis.exceptions.InvalidInputException;
import com.project.agro.analysis.imaging.BinaryMask;
import com.project.agro.analysis.imaging.PixelBuffer;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PixelBufferTest {

    @Test
    void of_rejectsMalformedBuffers() {
        assertThatThrownBy(() -> PixelBuffer.of(0, 10, 3, new byte[0]))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> PixelBuffer.of(2, 2, 4, new byte[16]))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("channels");
        assertThatThrownBy(() -> PixelBuffer.of(2, 2, 3, new byte[11]))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void of_copiesSamples() {
        byte[] samples = {10, 20, 30};
        PixelBuffer buffer = PixelBuffer.of(1, 1, 3, samples);
        samples[1] = 99;

        assertThat(buffer.green(0)).isEqualTo(20);
    }

    @Test
    void imageAdapters_keepChannels() {
        BufferedImage img = Fixtures.canvas(4, 3, Fixtures.YELLOWING);
        PixelBuffer buffer = PixelBuffer.fromImage(img);

        assertThat(buffer.width()).isEqualTo(4);
        assertThat(buffer.height()).isEqualTo(3);
        assertThat(buffer.red(3, 2)).isEqualTo(200);
        assertThat(buffer.green(3, 2)).isEqualTo(140);
        assertThat(buffer.blue(3, 2)).isEqualTo(40);
        assertThat(PixelBuffer.fromImage(buffer.toImage())).isEqualTo(buffer);
    }

    @Test
    void downscaledTo_preservesAspectRatio() {
        PixelBuffer buffer = PixelBuffer.filled(400, 200, 30, 120, 30);

        PixelBuffer.Scaled scaled = buffer.downscaledTo(100);

        assertThat(scaled.scale()).isEqualTo(0.25);
        assertThat(scaled.buffer().width()).isEqualTo(100);
        assertThat(scaled.buffer().height()).isEqualTo(50);
        assertThat(scaled.originalPixelCount()).isEqualTo(80_000L);
        assertThat(scaled.buffer().green(50, 25)).isBetween(118, 122);
    }

    @Test
    void downscaledTo_keepsSmallBuffer() {
        PixelBuffer buffer = PixelBuffer.filled(50, 40, 1, 2, 3);

        PixelBuffer.Scaled scaled = buffer.downscaledTo(100);

        assertThat(scaled.scale()).isEqualTo(1.0);
        assertThat(scaled.buffer()).isSameAs(buffer);
    }

    @Test
    void masked_zeroesPixelsOutsideMask() {
        PixelBuffer buffer = PixelBuffer.filled(2, 1, 100, 150, 200);
        BinaryMask keepLeft = BinaryMask.of(2, 1, new boolean[]{true, false});

        PixelBuffer masked = buffer.masked(keepLeft);

        assertThat(masked.green(0)).isEqualTo(150);
        assertThat(masked.red(1) + masked.green(1) + masked.blue(1)).isZero();
        assertThat(buffer.green(1)).isEqualTo(150);
    }

    @Test
    void toGray_usesRoundedLuma() {
        PixelBuffer buffer = PixelBuffer.filled(1, 1, 30, 120, 30);

        // 0.299*30 + 0.587*120 + 0.114*30 = 83.79
        assertThat(buffer.toGray()).containsExactly(84);
    }
}
