package com.aether.cli;

import com.aether.binding.BindingResolver;
import com.aether.binding.Diagnostic;
import com.aether.binding.FragmentValidator;
import com.aether.binding.GraalJsFragmentValidator;
import com.aether.codegen.CodeGenerator;
import com.aether.codegen.GeneratedProject;
import com.aether.config.ConfigLoadException;
import com.aether.config.ConfigService;
import com.aether.config.ConfigValidationException;
import com.aether.config.DesignerConfig;
import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.NodeRegistry;
import com.aether.persistence.DocumentFormatException;
import com.aether.persistence.DocumentSerializer;
import com.aether.persistence.ProjectStore;
import com.aether.validation.DocumentValidator;
import com.aether.validation.ProcessValidator;
import com.aether.validation.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;

/**
 * Command line entry point.
 *
 * <pre>
 * export &lt;project&gt; [outDir] [--dry-run] [--strict]
 * check &lt;project&gt;
 * validate &lt;project&gt;
 * new &lt;template&gt; &lt;file&gt;
 * </pre>
 *
 * Configuration is read from {@code aether.json} next to the project file.
 */
public final class AetherCli {

    private static final Logger LOGGER = LoggerFactory.getLogger(AetherCli.class);

    static final int USAGE = 64;

    private final PrintStream out;

    public AetherCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new AetherCli(System.out).run(args));
    }

    /**
     * Runs one command.
     *
     * @param args command line arguments
     * @return the process exit code
     */
    public int run(String[] args) {
        if (args.length == 0) {
            return usage();
        }
        List<String> positional = new ArrayList<>();
        boolean dryRun = false;
        boolean strict = false;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--dry-run" -> dryRun = true;
                case "--strict" -> strict = true;
                default -> {
                    if (args[i].startsWith("--")) {
                        out.println("Unknown option: " + args[i]);
                        return usage();
                    }
                    positional.add(args[i]);
                }
            }
        }

        switch (args[0]) {
            case "export":
                if (positional.isEmpty() || positional.size() > 2) {
                    return usage();
                }
                return export(Path.of(positional.get(0)),
                    positional.size() == 2 ? Path.of(positional.get(1)) : null, dryRun, strict);
            case "check":
                if (positional.size() != 1) {
                    return usage();
                }
                return check(Path.of(positional.get(0)));
            case "validate":
                if (positional.size() != 1) {
                    return usage();
                }
                return validate(Path.of(positional.get(0)));
            case "new":
                if (positional.size() != 2) {
                    return usage();
                }
                return create(positional.get(0), Path.of(positional.get(1)));
            default:
                out.println("Unknown command: " + args[0]);
                return usage();
        }
    }

    private int export(Path projectFile, Path outputDir, boolean dryRun, boolean strict) {
        DesignerConfig config = loadConfig(projectFile);
        if (config == null) {
            return ExportCommand.FAILED;
        }
        Path target = outputDir != null
            ? outputDir
            : projectFile.toAbsolutePath().getParent().resolve(config.exportDirectory());
        FragmentValidator validator = validator(config);
        try {
            int code = new ExportCommand(store(projectFile), new CodeGenerator(validator), projectFile, target,
                dryRun, strict).call();
            out.println(code == ExportCommand.OK ? "Exported to " + target : "Export finished with code " + code);
            return code;
        } finally {
            closeValidator(validator);
        }
    }

    private int check(Path projectFile) {
        DesignerConfig config = loadConfig(projectFile);
        if (config == null) {
            return ExportCommand.FAILED;
        }
        FragmentValidator validator = validator(config);
        try {
            Document document = store(projectFile).load(projectFile);
            List<Diagnostic> diagnostics = new DocumentValidator(new BindingResolver(validator)).validate(document);
            for (Diagnostic diagnostic : diagnostics) {
                out.println(diagnostic);
            }
            out.println(diagnostics.isEmpty() ? "No problems found" : diagnostics.size() + " problem(s) found");
            return diagnostics.isEmpty() ? ExportCommand.OK : ExportCommand.WARNINGS;
        } catch (IOException | DocumentFormatException e) {
            out.println("Cannot load " + projectFile + ": " + e.getMessage());
            return ExportCommand.FAILED;
        } finally {
            closeValidator(validator);
        }
    }

    private int validate(Path projectFile) {
        DesignerConfig config = loadConfig(projectFile);
        if (config == null) {
            return ExportCommand.FAILED;
        }
        FragmentValidator validator = validator(config);
        try (ProcessValidator external =
                 ProcessValidator.fromCommandLine(config.validationCommand(), config.validationTimeout())) {
            Document document = store(projectFile).load(projectFile);
            GeneratedProject project = new CodeGenerator(validator).generate(document);
            ValidationOutcome outcome = external.validate(project).get();
            if (!outcome.output().isBlank()) {
                out.print(outcome.output());
            }
            out.println("Validation " + outcome.status().name().toLowerCase(Locale.ROOT).replace('_', ' '));
            return outcome.passed() ? ExportCommand.OK : ExportCommand.FAILED;
        } catch (IOException | DocumentFormatException e) {
            out.println("Cannot load " + projectFile + ": " + e.getMessage());
            return ExportCommand.FAILED;
        } catch (ExecutionException e) {
            LOGGER.error("Validation could not run", e.getCause());
            out.println("Validation could not run: " + e.getCause().getMessage());
            return ExportCommand.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExportCommand.FAILED;
        } finally {
            closeValidator(validator);
        }
    }

    private int create(String template, Path file) {
        Document document;
        try {
            document = DocumentTemplates.byName(template, NodeRegistry.standard());
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage() + ". Available: " + String.join(", ", DocumentTemplates.NAMES));
            return USAGE;
        }
        try {
            store(file).save(document, file);
        } catch (IOException e) {
            out.println("Cannot write " + file + ": " + e.getMessage());
            return ExportCommand.FAILED;
        }
        out.println("Created " + file + " from template '" + template + "'");
        return ExportCommand.OK;
    }

    private DesignerConfig loadConfig(Path projectFile) {
        try {
            return new ConfigService(projectFile.toAbsolutePath().getParent()).load();
        } catch (ConfigLoadException | ConfigValidationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            out.println("Invalid configuration: " + e.getMessage());
            return null;
        }
    }

    private static ProjectStore store(Path file) {
        return new ProjectStore(new DocumentSerializer(NodeRegistry.standard()), file.toAbsolutePath().getParent());
    }

    private static FragmentValidator validator(DesignerConfig config) {
        return config.fragmentValidation() ? new GraalJsFragmentValidator() : FragmentValidator.permissive();
    }

    private static void closeValidator(FragmentValidator validator) {
        if (validator instanceof GraalJsFragmentValidator) {
            ((GraalJsFragmentValidator) validator).close();
        }
    }

    private int usage() {
        out.println("Usage:");
        out.println("  export <project> [outDir] [--dry-run] [--strict]");
        out.println("  check <project>");
        out.println("  validate <project>       runs the configured validation command on the generated scripts");
        out.println("  new <template> <file>    templates: " + String.join(", ", DocumentTemplates.NAMES));
        return USAGE;
    }
}
