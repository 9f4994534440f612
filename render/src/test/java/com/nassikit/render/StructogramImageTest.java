package com.nassikit.render;

import com.nassikit.layout.LayoutBuilder;
import com.nassikit.layout.LayoutNode;
import com.nassikit.tree.ControlNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rasterizing layouts. Pixel checks stay away from lines and text.
 */
class StructogramImageTest {

    private static LayoutNode ifLayout() {
        return new LayoutBuilder().build(
            ControlNode.If.simple("x > 0", List.of(ControlNode.Statement.of("y = 1;")))).orElseThrow();
    }

    @Test
    void imageSize_isLayoutPlusPaddingTimesScale() {
        LayoutNode layout = new LayoutNode.Statement("x ← 1", 64, 30);

        BufferedImage image = StructogramImage.render(layout, null, Theme.colored());

        assertEquals(88 * 2 + 1, image.getWidth());
        assertEquals(54 * 2 + 1, image.getHeight());
    }

    @Test
    void declaration_addsBandAboveChart() {
        LayoutNode layout = new LayoutNode.Statement("x ← 1", 64, 30);
        Theme theme = Theme.monochrome().withExportScale(1);

        BufferedImage plain = StructogramImage.render(layout, null, theme);
        BufferedImage declared = StructogramImage.render(layout, "public static void main(String[] args)", theme);

        assertEquals(plain.getHeight() + theme.declarationBandHeight(), declared.getHeight());
        assertTrue(declared.getWidth() > plain.getWidth());
    }

    @Test
    void ifHeader_isFilledWithThemeColor() {
        Theme theme = Theme.colored().withExportScale(1);

        BufferedImage image = StructogramImage.render(ifLayout(), null, theme);

        assertEquals(theme.ifHeader().getRGB() & 0xFFFFFF, image.getRGB(16, 44) & 0xFFFFFF);
    }

    @Test
    void monochrome_leavesHeaderWhite() {
        Theme theme = Theme.monochrome().withExportScale(1);

        BufferedImage image = StructogramImage.render(ifLayout(), null, theme);

        assertEquals(0xFFFFFF, image.getRGB(16, 44) & 0xFFFFFF);
    }

    @Test
    void writePng_createsReadableFile(@TempDir Path tempDir) throws Exception {
        BufferedImage image = StructogramImage.render(ifLayout(), "void check(int x)", Theme.colored());
        Path output = tempDir.resolve("nested").resolve("check.png");

        StructogramImage.writePng(image, output);

        assertTrue(Files.size(output) > 0);
        BufferedImage read = ImageIO.read(output.toFile());
        assertEquals(image.getWidth(), read.getWidth());
        assertEquals(image.getHeight(), read.getHeight());
    }
}
