package com.nassikit.exporter;

import com.nassikit.layout.LayoutBuilder;
import com.nassikit.layout.LayoutNode;
import com.nassikit.render.StructogramImage;
import com.nassikit.text.MethodDeclarations;
import com.nassikit.tree.MethodInfo;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line tool that turns analyzer output into structogram PNGs.
 * <p>
 * With a single method the output path is the PNG file. With several methods it is a directory
 * and every method with a control tree is written as {@code <name>.png}.
 */
public class StructogramExportTool {

    private static final String TAG = "[StructogramExportTool] ";

    private final ExportOptions options;
    private final ControlTreeReader reader;
    private final LayoutBuilder builder;

    public StructogramExportTool(ExportOptions options) {
        this.options = options;
        this.reader = new ControlTreeReader();
        this.builder = new LayoutBuilder(options.estimator());
    }

    /**
     * Export every method in {@code input}.
     *
     * @return the files written
     */
    public List<Path> export(Path input, Path output) throws IOException {
        List<MethodInfo> methods = reader.readMethods(input);
        System.out.println(TAG + "Read " + methods.size() + " method(s) from " + input);

        if (methods.size() == 1) {
            MethodInfo method = methods.get(0);
            return exportMethod(method, output) ? List.of(output) : List.of();
        }

        Files.createDirectories(output);
        List<Path> written = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        for (int i = 0; i < methods.size(); i++) {
            MethodInfo method = methods.get(i);
            Path target = output.resolve(uniqueFileName(method, i, usedNames));
            if (exportMethod(method, target)) {
                written.add(target);
            }
        }
        return written;
    }

    /**
     * Render one method; returns false when it has nothing to draw.
     */
    boolean exportMethod(MethodInfo method, Path target) throws IOException {
        String declaration = MethodDeclarations.toMethodDeclaration(method);
        if (!method.hasControlTree()) {
            System.err.println(TAG + declaration + ": No control-tree data available");
            return false;
        }

        Optional<LayoutNode> layout = builder.build(method.controlTree());
        if (layout.isEmpty()) {
            System.err.println(TAG + declaration + ": control tree has nothing to draw");
            return false;
        }

        BufferedImage image = StructogramImage.render(layout.get(), declaration, options.theme());
        StructogramImage.writePng(image, target);
        System.out.println(TAG + "Wrote " + target + " (" + image.getWidth() + "x" + image.getHeight() + ")");
        return true;
    }

    static String uniqueFileName(MethodInfo method, int index, Set<String> usedNames) {
        String base = method.name() == null || method.name().isBlank()
            ? "method" + (index + 1)
            : method.name().trim().replaceAll("[^A-Za-z0-9_$-]", "_");
        String name = base;
        int suffix = 2;
        while (!usedNames.add(name)) {
            name = base + "-" + suffix++;
        }
        return name + ".png";
    }

    /**
     * Parse command-line arguments.
     *
     * @throws IllegalArgumentException on unknown options, missing values or missing paths
     */
    static Arguments parseArguments(String[] args) {
        ExportOptions.Builder options = ExportOptions.builder();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--monochrome")) {
                options.monochrome(true);
            } else if (arg.equals("--font-metrics")) {
                options.fontMetrics(true);
            } else if (arg.equals("--scale")) {
                options.scale(parseInt(arg, valueAfter(args, i++)));
            } else if (arg.equals("--char-width")) {
                options.charWidth(parseDouble(arg, valueAfter(args, i++)));
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() != 2) {
            throw new IllegalArgumentException("Expected <input.json> <output>, got " + positional.size() + " path(s)");
        }
        return new Arguments(Path.of(positional.get(0)), Path.of(positional.get(1)), options.build());
    }

    record Arguments(Path input, Path output, ExportOptions options) {
    }

    private static String valueAfter(String[] args, int index) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index]);
        }
        return args[index + 1];
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + value, e);
        }
    }

    private static double parseDouble(String option, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + value, e);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: StructogramExportTool <input.json> <output> [options]");
        System.out.println();
        System.out.println("Draws Nassi-Shneiderman diagrams from control-tree JSON.");
        System.out.println("One method: <output> is the PNG file. Several: <output> is a directory.");
        System.out.println();
        System.out.println("  --monochrome        no header tints");
        System.out.println("  --scale <n>         pixels per layout unit (default " + ExportOptions.DEFAULT_SCALE + ")");
        System.out.println("  --char-width <n>    fixed character width for text measurement");
        System.out.println("  --font-metrics      measure text with the drawing font");
    }

    /**
     * Run the tool and return the process exit status.
     */
    static int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return 1;
        }

        Arguments arguments;
        try {
            arguments = parseArguments(args);
        } catch (IllegalArgumentException e) {
            System.err.println(TAG + e.getMessage());
            printUsage();
            return 1;
        }

        try {
            List<Path> written = new StructogramExportTool(arguments.options())
                .export(arguments.input(), arguments.output());
            System.out.println(TAG + "Exported " + written.size() + " structogram(s)");
            return 0;
        } catch (IOException e) {
            System.err.println(TAG + "I/O error: " + e.getMessage());
            return 1;
        } catch (ControlTreeException e) {
            System.err.println(TAG + e.getMessage());
            return 1;
        }
    }

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        System.exit(run(args));
    }
}
