package com.nassikit.render;

import com.nassikit.layout.LayoutNode;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Rasterizes a laid-out structogram, with its method declaration above the chart, into an image.
 */
public final class StructogramImage {

    private StructogramImage() {
    }

    /**
     * Render {@code layout} onto a new image.
     *
     * @param declaration method declaration drawn above the chart, or null for none
     * @return an RGB image {@code theme.exportScale()} times the logical size
     */
    public static BufferedImage render(LayoutNode layout, String declaration, Theme theme) {
        StructogramRenderer renderer = new StructogramRenderer(theme);
        boolean hasDeclaration = declaration != null && !declaration.isBlank();
        int padding = theme.canvasPadding();
        int declarationHeight = hasDeclaration ? theme.declarationBandHeight() : 0;

        int contentWidth = layout.width();
        if (hasDeclaration) {
            contentWidth = Math.max(contentWidth, declarationWidth(declaration, theme));
        }
        int logicalWidth = contentWidth + padding * 2;
        int logicalHeight = declarationHeight + layout.height() + padding * 2;

        int scale = Math.max(1, theme.exportScale());
        BufferedImage image = new BufferedImage(logicalWidth * scale + 1, logicalHeight * scale + 1,
            BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(theme.body());
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.scale(scale, scale);
            renderer.prepare(g);

            if (hasDeclaration) {
                g.setFont(theme.declarationFont());
                g.setColor(theme.text());
                g.drawString(declaration.trim(), padding,
                    padding + theme.declarationTopPadding() + theme.fontSize());
                g.setFont(theme.font());
            }

            renderer.render(g, layout, padding, padding + declarationHeight, layout.width());
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Write an image as PNG, creating missing parent directories.
     */
    public static void writePng(BufferedImage image, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, "PNG", path.toFile())) {
            throw new IOException("No PNG writer available for " + path);
        }
    }

    private static int declarationWidth(String declaration, Theme theme) {
        FontMetricsWidthEstimator estimator = new FontMetricsWidthEstimator(theme.declarationFont());
        return (int) Math.ceil(estimator.estimate(declaration.trim()));
    }
}
